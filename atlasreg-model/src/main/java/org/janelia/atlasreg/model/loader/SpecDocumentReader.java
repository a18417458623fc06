package org.janelia.atlasreg.model.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.ReferencePoint;
import org.janelia.atlasreg.model.TransformTemplate;
import org.janelia.atlasreg.model.TransformType;

/**
 * Reads the prefixed template keys shared by atlas and sample documents ("ccf-template-path", "source-template-size"...).
 * Problems are collected instead of thrown so that the caller can report all of them at once.
 */
class SpecDocumentReader {

    private static final String[] AXES = {"x", "y", "z"};

    private final JsonNode document;
    private final String prefix;
    private final Path baseDir;
    private final List<String> errors = new ArrayList<>();

    SpecDocumentReader(JsonNode document, String prefix, Path baseDir) {
        this.document = document;
        this.prefix = prefix;
        this.baseDir = baseDir;
    }

    static JsonNode readDocument(Path documentPath) {
        try {
            return ObjectMapperFactory.instance().getYamlObjectMapper().readTree(documentPath.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + documentPath, e);
        }
    }

    static String documentStem(Path documentPath) {
        String fileName = documentPath.getFileName().toString();
        int extensionIndex = fileName.lastIndexOf('.');
        return extensionIndex > 0 ? fileName.substring(0, extensionIndex) : fileName;
    }

    static boolean isDocumentReference(String reference) {
        String lower = reference.toLowerCase();
        return lower.endsWith(".yml") || lower.endsWith(".yaml") || lower.endsWith(".json");
    }

    List<String> getErrors() {
        return errors;
    }

    String key(String suffix) {
        return prefix + "-" + suffix;
    }

    JsonNode node(String suffix) {
        JsonNode n = document.get(key(suffix));
        return n == null || n.isNull() ? null : n;
    }

    /**
     * Fill the builder with all template related keys.
     */
    AtlasSpec.Builder readTemplate(AtlasSpec.Builder builder) {
        builder.templatePath(path(node("template-path")))
                .annotationPaths(pathList("annotations-path", baseDir))
                .structureTreePaths(pathList("structure-tree", baseDir))
                .resolution(triple("template-resolution", "-um"))
                .size(intTriple("template-size"))
                .referencePoints(referencePoints())
                .structure(text("template-structure"))
                .orientation(text("template-orientation"))
                .downsampling(downsampling(node("downsampling-factor")))
                .transformTemplates(transformTemplates(node("transform-templates")))
                .allowFinerResolution(bool("allow-finer-resolution"));
        return builder;
    }

    String text(String suffix) {
        JsonNode n = node(suffix);
        if (n == null) {
            return null;
        } else if (!n.isValueNode()) {
            errors.add(key(suffix) + " must be a string");
            return null;
        }
        return StringUtils.trimToNull(n.asText());
    }

    boolean bool(String suffix) {
        JsonNode n = node(suffix);
        if (n == null) {
            return false;
        } else if (n.isBoolean()) {
            return n.booleanValue();
        } else if (n.isTextual()) {
            return Boolean.parseBoolean(n.asText());
        }
        errors.add(key(suffix) + " must be a boolean");
        return false;
    }

    Path path(JsonNode n) {
        return resolve(n, baseDir);
    }

    Path resolve(JsonNode n, Path relativeTo) {
        if (n == null || StringUtils.isBlank(n.asText())) {
            return null;
        }
        Path p = Path.of(n.asText().trim());
        return relativeTo == null || p.isAbsolute() ? p : relativeTo.resolve(p).normalize();
    }

    List<Path> pathList(String suffix, Path relativeTo) {
        return pathList(suffix, node(suffix), relativeTo);
    }

    List<Path> pathList(String name, JsonNode n, Path relativeTo) {
        List<Path> paths = new ArrayList<>();
        if (n == null) {
            return paths;
        } else if (n.isArray()) {
            n.forEach(item -> {
                Path p = resolve(item, relativeTo);
                if (p != null) {
                    paths.add(p);
                }
            });
        } else if (n.isTextual()) {
            Path p = resolve(n, relativeTo);
            if (p != null) {
                paths.add(p);
            }
        } else {
            errors.add(name + " must be a path or a list of paths");
        }
        return paths;
    }

    private double[] triple(String suffix, String componentSuffix) {
        JsonNode n = node(suffix);
        if (n == null) {
            return null;
        }
        double[] values = new double[3];
        if (n.isArray() && n.size() == 3) {
            for (int d = 0; d < 3; d++) {
                values[d] = number(suffix, n.get(d));
            }
        } else if (n.isObject()) {
            for (int d = 0; d < 3; d++) {
                JsonNode component = n.has(AXES[d] + componentSuffix) ? n.get(AXES[d] + componentSuffix) : n.get(AXES[d]);
                if (component == null) {
                    errors.add(key(suffix) + " has no " + AXES[d] + " component");
                    return null;
                }
                values[d] = number(suffix, component);
            }
        } else {
            errors.add(key(suffix) + " must have an x, y and z component");
            return null;
        }
        return values;
    }

    private int[] intTriple(String suffix) {
        double[] values = triple(suffix, "");
        if (values == null) {
            return null;
        }
        int[] intValues = new int[3];
        for (int d = 0; d < 3; d++) {
            if (values[d] != Math.rint(values[d])) {
                errors.add(key(suffix) + " must have integer components");
            }
            intValues[d] = (int) values[d];
        }
        return intValues;
    }

    private double number(String suffix, JsonNode n) {
        if (n.isNumber()) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(n.asText());
        } catch (NumberFormatException e) {
            errors.add(key(suffix) + " has a non numeric value " + n.asText());
            return Double.NaN;
        }
    }

    private List<ReferencePoint> referencePoints() {
        List<ReferencePoint> points = new ArrayList<>();
        JsonNode n = node("template-reference");
        if (n == null) {
            return points;
        } else if (!n.isObject()) {
            errors.add(key("template-reference") + " must map names to x, y, z coordinates");
            return points;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode p = field.getValue();
            if (p.has("x") && p.has("y") && p.has("z")) {
                points.add(new ReferencePoint(field.getKey(), p.get("x").asInt(), p.get("y").asInt(), p.get("z").asInt()));
            } else {
                errors.add("reference point " + field.getKey() + " must have x, y and z coordinates");
            }
        }
        return points;
    }

    DownsamplingFactor downsampling(JsonNode n) {
        if (n == null) {
            return null;
        } else if (n.isNumber()) {
            return DownsamplingFactor.uniform(n.doubleValue());
        } else if (n.isArray() && n.size() == 3) {
            return DownsamplingFactor.explicit(n.get(0).asDouble(), n.get(1).asDouble(), n.get(2).asDouble());
        } else if (n.isTextual()) {
            String value = n.asText().trim().toLowerCase();
            if ("auto".equals(value)) {
                return DownsamplingFactor.AUTO;
            } else if ("none".equals(value) || value.isEmpty()) {
                return DownsamplingFactor.NONE;
            }
            try {
                return DownsamplingFactor.uniform(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                errors.add("invalid downsampling factor " + n.asText());
                return null;
            }
        }
        errors.add("downsampling factor must be 'auto', 'none', a number or 3 numbers");
        return null;
    }

    List<TransformTemplate> transformTemplates(JsonNode n) {
        List<TransformTemplate> templates = new ArrayList<>();
        if (n == null) {
            return templates;
        } else if (!n.isArray()) {
            errors.add("transform templates must be a list");
            return templates;
        }
        for (JsonNode item : n) {
            try {
                templates.add(transformTemplate(item));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return templates;
    }

    private TransformTemplate transformTemplate(JsonNode item) {
        if (item.isTextual()) {
            return new TransformTemplate(item.asText(), TransformType.fromString(item.asText()));
        }
        String type = item.path("type").asText(null);
        String name = item.path("name").asText(type);
        Boolean invertible = item.has("invertible") ? item.get("invertible").asBoolean() : null;
        Path parameterFile = path(item.get("parameter-file"));
        Map<String, String> parameters = new LinkedHashMap<>();
        JsonNode parametersNode = item.get("parameters");
        if (parametersNode != null && parametersNode.isObject()) {
            parametersNode.fields().forEachRemaining(e -> parameters.put(e.getKey(), e.getValue().isValueNode()
                    ? e.getValue().asText()
                    : e.getValue().toString()));
        }
        return new TransformTemplate(name, TransformType.fromString(type), invertible, parameterFile, parameters);
    }
}
