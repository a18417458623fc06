package org.janelia.atlasreg.transform;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.atlasreg.geometry.Affine3D;
import org.janelia.atlasreg.geometry.SpatialTransform;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;
import org.janelia.atlasreg.model.loader.ObjectMapperFactory;
import org.janelia.atlasreg.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Persists composed transforms as JSON. Affine legs are stored as row packed 3x4 matrices; engine legs are stored as
 * references to the engine parameters and must be resolved again when the transform is read back.
 */
public class TransformStore {

    /**
     * Resolves an engine parameter reference into a transform.
     */
    public interface EngineTransformResolver {
        SpatialTransform resolve(String parametersRef, boolean inverse);
    }

    public static class PersistedGrid {
        private long[] dimensions;
        private double[] resolution;

        public long[] getDimensions() {
            return dimensions;
        }

        public void setDimensions(long[] dimensions) {
            this.dimensions = dimensions;
        }

        public double[] getResolution() {
            return resolution;
        }

        public void setResolution(double[] resolution) {
            this.resolution = resolution;
        }
    }

    public static class PersistedLeg {
        private String type;
        private String description;
        private double[] matrix;
        private Integer stepIndex;
        private String passName;
        private String parametersRef;
        private boolean inverse;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public double[] getMatrix() {
            return matrix;
        }

        public void setMatrix(double[] matrix) {
            this.matrix = matrix;
        }

        public Integer getStepIndex() {
            return stepIndex;
        }

        public void setStepIndex(Integer stepIndex) {
            this.stepIndex = stepIndex;
        }

        public String getPassName() {
            return passName;
        }

        public void setPassName(String passName) {
            this.passName = passName;
        }

        public String getParametersRef() {
            return parametersRef;
        }

        public void setParametersRef(String parametersRef) {
            this.parametersRef = parametersRef;
        }

        public boolean isInverse() {
            return inverse;
        }

        public void setInverse(boolean inverse) {
            this.inverse = inverse;
        }
    }

    public static class PersistedTransform {
        private TransformDirection direction;
        private TransformVariant variant;
        private PersistedGrid inputGrid;
        private PersistedGrid outputGrid;
        private List<PersistedLeg> legs = new ArrayList<>();

        public TransformDirection getDirection() {
            return direction;
        }

        public void setDirection(TransformDirection direction) {
            this.direction = direction;
        }

        public TransformVariant getVariant() {
            return variant;
        }

        public void setVariant(TransformVariant variant) {
            this.variant = variant;
        }

        public PersistedGrid getInputGrid() {
            return inputGrid;
        }

        public void setInputGrid(PersistedGrid inputGrid) {
            this.inputGrid = inputGrid;
        }

        public PersistedGrid getOutputGrid() {
            return outputGrid;
        }

        public void setOutputGrid(PersistedGrid outputGrid) {
            this.outputGrid = outputGrid;
        }

        public List<PersistedLeg> getLegs() {
            return legs;
        }

        public void setLegs(List<PersistedLeg> legs) {
            this.legs = legs;
        }
    }

    private static final String AFFINE_LEG = "affine";
    private static final String ENGINE_LEG = "engine";

    private final ObjectMapper objectMapper;
    private final Logger logger;

    public TransformStore(Logger logger) {
        this.objectMapper = ObjectMapperFactory.instance().getDefaultObjectMapper();
        this.logger = logger;
    }

    public void write(ComposedTransform composed, Path transformPath) {
        PersistedTransform persisted = new PersistedTransform();
        persisted.setDirection(composed.getDirection());
        persisted.setVariant(composed.getVariant());
        persisted.setInputGrid(toPersistedGrid(composed.getInputGrid()));
        persisted.setOutputGrid(toPersistedGrid(composed.getOutputGrid()));
        for (TransformLeg leg : composed.getLegs()) {
            PersistedLeg persistedLeg = new PersistedLeg();
            persistedLeg.setDescription(leg.getDescription());
            if (leg.isAffine()) {
                persistedLeg.setType(AFFINE_LEG);
                persistedLeg.setMatrix(leg.getAffine().getRowPackedCopy());
            } else {
                persistedLeg.setType(ENGINE_LEG);
                persistedLeg.setStepIndex(leg.getStepIndex());
                persistedLeg.setPassName(leg.getPassName());
                persistedLeg.setParametersRef(leg.getParametersRef());
                persistedLeg.setInverse(leg.isInverse());
                if (leg.getParametersRef() == null) {
                    logger.warn("Leg {} has no engine reference and cannot be restored from {}", leg, transformPath);
                }
            }
            persisted.getLegs().add(persistedLeg);
        }
        try {
            objectMapper.writeValue(FileUtils.createParentDirs(transformPath).toFile(), persisted);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing transform " + transformPath, e);
        }
        logger.info("Saved {} {} transform to {}", composed.getDirection(), composed.getVariant(), transformPath);
    }

    /**
     * Read back a persisted transform.
     *
     * @param resolver resolves engine legs; may be null if the transform has only affine legs
     */
    public ComposedTransform read(Path transformPath, EngineTransformResolver resolver) {
        PersistedTransform persisted;
        try {
            persisted = objectMapper.readValue(transformPath.toFile(), PersistedTransform.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading transform " + transformPath, e);
        }
        List<TransformLeg> legs = new ArrayList<>();
        for (PersistedLeg persistedLeg : persisted.getLegs()) {
            if (AFFINE_LEG.equals(persistedLeg.getType())) {
                legs.add(TransformLeg.affine(Affine3D.fromRowPacked(persistedLeg.getMatrix()), persistedLeg.getDescription()));
            } else {
                if (resolver == null || persistedLeg.getParametersRef() == null) {
                    throw new AtlasRegistrationException("Cannot restore leg " + persistedLeg.getDescription() + " of " + transformPath);
                }
                SpatialTransform transform = resolver.resolve(persistedLeg.getParametersRef(), persistedLeg.isInverse());
                legs.add(TransformLeg.pass(transform, persistedLeg.getStepIndex(), persistedLeg.getPassName(),
                        persistedLeg.getParametersRef(), persistedLeg.isInverse()));
            }
        }
        return new ComposedTransform(persisted.getDirection(), persisted.getVariant(),
                fromPersistedGrid(persisted.getInputGrid()), fromPersistedGrid(persisted.getOutputGrid()), legs);
    }

    private PersistedGrid toPersistedGrid(ImageGrid grid) {
        PersistedGrid persistedGrid = new PersistedGrid();
        persistedGrid.setDimensions(grid.getDimensions());
        persistedGrid.setResolution(grid.getResolution());
        return persistedGrid;
    }

    private ImageGrid fromPersistedGrid(PersistedGrid persistedGrid) {
        return new ImageGrid(persistedGrid.getDimensions(), persistedGrid.getResolution());
    }
}
