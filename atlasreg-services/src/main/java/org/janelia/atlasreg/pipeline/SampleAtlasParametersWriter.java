package org.janelia.atlasreg.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.collections4.CollectionUtils;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.ReferencePoint;
import org.janelia.atlasreg.model.SampleSpec;
import org.janelia.atlasreg.model.loader.ObjectMapperFactory;
import org.janelia.atlasreg.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Writes an atlas document that describes the sample space: the sample template annotated with the atlas annotations
 * brought into sample space followed by the sample's own annotations. The document can be used as a target for other
 * samples.
 */
public class SampleAtlasParametersWriter {

    private static final String PREFIX = "target-";

    private final Logger logger;

    public SampleAtlasParametersWriter(Logger logger) {
        this.logger = logger;
    }

    public void write(SampleSpec sample, List<Path> transformedAnnotations, List<Path> transformedStructureTrees, Path documentPath) {
        AtlasSpec source = sample.getSource();
        List<Path> annotations = new ArrayList<>(transformedAnnotations);
        annotations.addAll(source.getAnnotationPaths());
        List<Path> structureTrees = new ArrayList<>(transformedStructureTrees);
        structureTrees.addAll(source.getStructureTreePaths());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(PREFIX + "id", sample.getId());
        document.put(PREFIX + "template-path", absolute(source.getTemplatePath()));
        document.put(PREFIX + "annotations-path", annotations.stream().map(this::absolute).collect(Collectors.toList()));
        if (structureTrees.size() == annotations.size()) {
            document.put(PREFIX + "structure-tree", structureTrees.stream().map(this::absolute).collect(Collectors.toList()));
        } else if (CollectionUtils.isNotEmpty(structureTrees)) {
            logger.warn("Structure trees of {} are left out since they do not match the annotations one to one", sample.getId());
        }
        double[] resolution = source.getResolution();
        document.put(PREFIX + "template-resolution", ImmutableMap.of("x-um", resolution[0], "y-um", resolution[1], "z-um", resolution[2]));
        int[] size = source.getSize();
        document.put(PREFIX + "template-size", ImmutableMap.of("x", size[0], "y", size[1], "z", size[2]));
        if (CollectionUtils.isNotEmpty(source.getReferencePoints())) {
            Map<String, Object> references = new LinkedHashMap<>();
            for (ReferencePoint p : source.getReferencePoints()) {
                references.put(p.getName(), ImmutableMap.of("x", p.get(0), "y", p.get(1), "z", p.get(2)));
            }
            document.put(PREFIX + "template-reference", references);
        }
        if (source.getStructure() != null) {
            document.put(PREFIX + "template-structure", source.getStructure());
        }
        document.put(PREFIX + "template-orientation", source.getOrientation());
        try {
            ObjectMapperFactory.instance().getYamlObjectMapper()
                    .writeValue(FileUtils.createParentDirs(documentPath).toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + documentPath, e);
        }
        logger.info("Saved sample space atlas parameters of {} to {}", sample.getId(), documentPath);
    }

    private String absolute(Path p) {
        return p.toAbsolutePath().toString();
    }
}
