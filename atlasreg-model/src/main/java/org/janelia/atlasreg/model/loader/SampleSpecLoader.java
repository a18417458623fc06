package org.janelia.atlasreg.model.loader;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.janelia.atlasreg.model.AtlasHierarchy;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.DownsamplingFactor;
import org.janelia.atlasreg.model.RegistrationDirection;
import org.janelia.atlasreg.model.SampleSpec;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a sample document. The sample template is described with "source-" keys; every other "source-*-path" entry
 * lists images acquired on the same grid as the template, with paths relative to the template directory.
 * The target atlas is given by "target-template-path", the path of an atlas document.
 */
public class SampleSpecLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SampleSpecLoader.class);

    private static final String SOURCE_PREFIX = "source";
    private static final Pattern CHANNEL_KEY = Pattern.compile("^source-(.+)-path$");
    private static final ImmutableSet<String> TEMPLATE_PATH_KEYS = ImmutableSet.of("source-template-path", "source-annotations-path");

    private final AtlasSpecLoader atlasSpecLoader;

    public SampleSpecLoader(AtlasSpecLoader atlasSpecLoader) {
        this.atlasSpecLoader = atlasSpecLoader;
    }

    /**
     * Load the sample and its whole target hierarchy.
     */
    public SampleSpec load(Path documentPath) {
        return load(documentPath, new AtlasHierarchy());
    }

    /**
     * Load the sample. Target documents are added to the given hierarchy, which may already hold atlases referred
     * to by id.
     */
    public SampleSpec load(Path documentPath, AtlasHierarchy atlases) {
        JsonNode document = SpecDocumentReader.readDocument(documentPath);
        Path baseDir = documentPath.toAbsolutePath().getParent();
        return load(document, baseDir, SpecDocumentReader.documentStem(documentPath), atlases);
    }

    public SampleSpec load(JsonNode document, Path baseDir, String defaultId, AtlasHierarchy atlases) {
        if (document == null || !document.isObject()) {
            throw new InvalidSpecException(defaultId, "sample document must be a mapping");
        }
        SpecDocumentReader reader = new SpecDocumentReader(document, SOURCE_PREFIX, baseDir);
        String sampleId = StringUtils.defaultIfBlank(reader.text("id"), defaultId);
        AtlasSpec source = reader.readTemplate(AtlasSpec.builder(sampleId)).build();

        String targetId = null;
        JsonNode targetDocument = document.get("target-template-path");
        JsonNode targetIdNode = document.get("target-id");
        if (targetDocument != null && StringUtils.isNotBlank(targetDocument.asText())) {
            Path targetPath = reader.path(targetDocument);
            LOG.info("Load target atlas hierarchy of sample {} from {}", sampleId, targetPath);
            targetId = atlasSpecLoader.loadHierarchy(targetPath, atlases).getId();
        } else if (targetIdNode != null) {
            targetId = StringUtils.trimToNull(targetIdNode.asText());
        }

        SampleSpec.Builder builder = SampleSpec.builder(source, atlases).targetId(targetId);
        Path templateDir = source.getTemplatePath() == null ? baseDir : source.getTemplatePath().toAbsolutePath().getParent();
        Iterator<String> names = document.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            Matcher m = CHANNEL_KEY.matcher(name);
            if (m.matches() && !TEMPLATE_PATH_KEYS.contains(name)) {
                List<Path> channelPaths = reader.pathList(name, document.get(name), templateDir);
                channelPaths.forEach(builder::addChannel);
            }
        }

        JsonNode directionNode = document.get("registration-direction");
        if (directionNode != null) {
            builder.direction(direction(directionNode.asText(), reader));
        }
        JsonNode levelDirections = document.get("level-directions");
        if (levelDirections != null && levelDirections.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> levels = levelDirections.fields();
            while (levels.hasNext()) {
                Map.Entry<String, JsonNode> level = levels.next();
                RegistrationDirection levelDirection = direction(level.getValue().asText(), reader);
                if (levelDirection != null) {
                    builder.levelDirection(level.getKey(), levelDirection);
                }
            }
        }
        JsonNode templates = document.has("transform-templates")
                ? document.get("transform-templates")
                : document.get("source-to-target-transform-templates");
        builder.transformTemplates(reader.transformTemplates(templates));
        DownsamplingFactor downsamplingOverride = reader.downsampling(document.get("downsampling-factor"));
        if (downsamplingOverride != null) {
            builder.downsamplingOverride(downsamplingOverride);
        }
        JsonNode targetOutput = document.get("target-template-output");
        if (targetOutput != null) {
            builder.targetParametersOutput(reader.path(targetOutput));
        }
        if (!reader.getErrors().isEmpty()) {
            throw new InvalidSpecException(sampleId, reader.getErrors());
        }
        return builder.build();
    }

    private RegistrationDirection direction(String value, SpecDocumentReader reader) {
        try {
            return RegistrationDirection.fromString(value);
        } catch (IllegalArgumentException e) {
            reader.getErrors().add(e.getMessage());
            return null;
        }
    }
}
