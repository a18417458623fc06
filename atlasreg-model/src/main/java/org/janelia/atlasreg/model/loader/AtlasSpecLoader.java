package org.janelia.atlasreg.model.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.janelia.atlasreg.model.AtlasHierarchy;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.exceptions.CyclicChainException;
import org.janelia.atlasreg.model.exceptions.InvalidSpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads atlas descriptions from YAML documents. All keys of an atlas document share a "target-" or a "ccf-" prefix,
 * e.g. "ccf-template-path", "ccf-template-resolution".
 */
public class AtlasSpecLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AtlasSpecLoader.class);

    static final List<String> ATLAS_PREFIXES = ImmutableList.of("target", "ccf");

    /**
     * Build a spec from an already parsed document. The document is only read.
     *
     * @param document parsed atlas document
     * @param baseDir directory relative paths are resolved against; may be null
     * @param defaultId id used when the document does not define one
     */
    public AtlasSpec load(JsonNode document, Path baseDir, String defaultId) {
        String prefix = detectPrefix(document, defaultId);
        SpecDocumentReader reader = new SpecDocumentReader(document, prefix, baseDir);
        String id = StringUtils.defaultIfBlank(reader.text("id"), defaultId);
        AtlasSpec.Builder builder = reader.readTemplate(AtlasSpec.builder(id));
        String parentReference = reader.text("template-parent");
        if (parentReference != null) {
            builder.parentId(parentIdOf(parentReference, baseDir));
        }
        if (!reader.getErrors().isEmpty()) {
            throw new InvalidSpecException(id, reader.getErrors());
        }
        return builder.build();
    }

    public AtlasSpec load(Path documentPath) {
        JsonNode document = SpecDocumentReader.readDocument(documentPath);
        return load(document, documentPath.toAbsolutePath().getParent(), SpecDocumentReader.documentStem(documentPath))
                .toBuilder()
                .documentPath(documentPath)
                .build();
    }

    /**
     * Load the atlas document and every parent document it refers to into the given hierarchy.
     *
     * @return the spec loaded from the given document
     * @throws CyclicChainException if the parent documents refer back to an already loaded document
     */
    public AtlasSpec loadHierarchy(Path documentPath, AtlasHierarchy atlases) {
        Map<Path, String> visited = new LinkedHashMap<>();
        AtlasSpec first = null;
        Path current = documentPath;
        while (current != null) {
            Path canonicalPath = canonical(current);
            if (visited.containsKey(canonicalPath)) {
                throw new CyclicChainException(new ArrayList<>(visited.values()), visited.get(canonicalPath));
            }
            LOG.debug("Load atlas document {}", current);
            AtlasSpec spec = load(current);
            visited.put(canonicalPath, spec.getId());
            if (!atlases.contains(spec.getId())) {
                atlases.add(spec);
            }
            if (first == null) {
                first = spec;
            }
            current = parentDocument(current);
        }
        return first;
    }

    private Path parentDocument(Path documentPath) {
        JsonNode document = SpecDocumentReader.readDocument(documentPath);
        String prefix = detectPrefix(document, documentPath.toString());
        JsonNode parentNode = document.get(prefix + "-template-parent");
        if (parentNode == null || StringUtils.isBlank(parentNode.asText())) {
            return null;
        }
        String parentReference = parentNode.asText().trim();
        if (!SpecDocumentReader.isDocumentReference(parentReference)) {
            // the parent is referred to by id and must be loaded by the caller
            return null;
        }
        return documentPath.toAbsolutePath().getParent().resolve(parentReference).normalize();
    }

    /**
     * Parent references are either ids or paths of parent documents. A document is identified by its "-id" entry
     * or by its file name without extension.
     */
    String parentIdOf(String parentReference, Path baseDir) {
        if (!SpecDocumentReader.isDocumentReference(parentReference)) {
            return parentReference;
        }
        Path parentPath = baseDir == null ? Path.of(parentReference) : baseDir.resolve(parentReference).normalize();
        if (Files.isRegularFile(parentPath)) {
            JsonNode parentDocument = SpecDocumentReader.readDocument(parentPath);
            String parentPrefix = detectPrefix(parentDocument, parentPath.toString());
            JsonNode idNode = parentDocument.get(parentPrefix + "-id");
            if (idNode != null && StringUtils.isNotBlank(idNode.asText())) {
                return idNode.asText().trim();
            }
        }
        return SpecDocumentReader.documentStem(parentPath);
    }

    static String detectPrefix(JsonNode document, String specId) {
        if (document == null || !document.isObject()) {
            throw new InvalidSpecException(specId, "atlas document must be a mapping");
        }
        Iterator<String> names = document.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            for (String prefix : ATLAS_PREFIXES) {
                if (name.startsWith(prefix + "-")) {
                    return prefix;
                }
            }
        }
        throw new InvalidSpecException(specId, "atlas document keys must start with one of " + ATLAS_PREFIXES);
    }

    private Path canonical(Path p) {
        try {
            return p.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Atlas document " + p + " cannot be read", e);
        }
    }
}
