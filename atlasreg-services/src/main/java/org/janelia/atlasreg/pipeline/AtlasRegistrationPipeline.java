package org.janelia.atlasreg.pipeline;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import org.janelia.atlasreg.apply.ImageApplier;
import org.janelia.atlasreg.apply.ImageTask;
import org.janelia.atlasreg.apply.ImageTaskResult;
import org.janelia.atlasreg.config.ApplicationConfig;
import org.janelia.atlasreg.config.AtlasRegistrationSettings;
import org.janelia.atlasreg.engine.RegistrationEngine;
import org.janelia.atlasreg.image.ImageGrid;
import org.janelia.atlasreg.image.ImageStore;
import org.janelia.atlasreg.image.NrrdImageStore;
import org.janelia.atlasreg.model.AssociatedImage;
import org.janelia.atlasreg.model.AtlasSpec;
import org.janelia.atlasreg.model.AtlasSpecValidator;
import org.janelia.atlasreg.model.ImageKind;
import org.janelia.atlasreg.model.RegistrationDirection;
import org.janelia.atlasreg.model.SampleSpec;
import org.janelia.atlasreg.model.exceptions.AtlasRegistrationException;
import org.janelia.atlasreg.registration.ChainResolver;
import org.janelia.atlasreg.registration.RegistrationChain;
import org.janelia.atlasreg.registration.RegistrationDriver;
import org.janelia.atlasreg.registration.RegistrationStep;
import org.janelia.atlasreg.registration.ResolutionManager;
import org.janelia.atlasreg.registration.TransformResult;
import org.janelia.atlasreg.registration.WorkingImageCache;
import org.janelia.atlasreg.registration.WorkingImages;
import org.janelia.atlasreg.transform.ComposedTransform;
import org.janelia.atlasreg.transform.NoInverseAvailableException;
import org.janelia.atlasreg.transform.TransformComposer;
import org.janelia.atlasreg.transform.TransformDirection;
import org.janelia.atlasreg.transform.TransformStore;
import org.janelia.atlasreg.transform.TransformVariant;
import org.janelia.atlasreg.utils.ExecutorServiceFactory;
import org.janelia.atlasreg.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers a sample through its atlas chain and produces the requested outputs.
 *
 * A run validates the sample and its atlases before any image is read, registers the steps in order and stops at the
 * first step that fails, keeping the results of the steps before it. Outputs are then produced for every completed
 * level that asks for them: sample images in the level space for the forward direction, level images in sample space
 * for the inverse direction.
 */
public class AtlasRegistrationPipeline implements AutoCloseable {

    static final String TRANSFORMS_DIR = "transforms";

    private final AtlasRegistrationSettings settings;
    private final RegistrationEngine engine;
    private final ImageStore imageStore;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final Logger logger;
    private final ChainResolver chainResolver;
    private final RegistrationDriver registrationDriver;
    private final TransformComposer transformComposer;
    private final TransformStore transformStore;
    private final ImageApplier imageApplier;
    private final SampleAtlasParametersWriter sampleAtlasParametersWriter;

    public AtlasRegistrationPipeline(AtlasRegistrationSettings settings,
                                     RegistrationEngine engine,
                                     ImageStore imageStore,
                                     ExecutorService executorService,
                                     Logger logger) {
        this(settings, engine, imageStore, executorService, false, logger);
    }

    private AtlasRegistrationPipeline(AtlasRegistrationSettings settings,
                                      RegistrationEngine engine,
                                      ImageStore imageStore,
                                      ExecutorService executorService,
                                      boolean ownsExecutor,
                                      Logger logger) {
        this.settings = settings;
        this.engine = engine;
        this.imageStore = imageStore;
        this.executorService = executorService;
        this.ownsExecutor = ownsExecutor;
        this.logger = logger;
        this.chainResolver = new ChainResolver(LoggerFactory.getLogger(ChainResolver.class));
        this.registrationDriver = new RegistrationDriver(engine, LoggerFactory.getLogger(RegistrationDriver.class));
        this.transformComposer = new TransformComposer(LoggerFactory.getLogger(TransformComposer.class));
        this.transformStore = new TransformStore(LoggerFactory.getLogger(TransformStore.class));
        this.imageApplier = new ImageApplier(engine, imageStore, executorService, settings.getGridTolerance(),
                LoggerFactory.getLogger(ImageApplier.class));
        this.sampleAtlasParametersWriter = new SampleAtlasParametersWriter(LoggerFactory.getLogger(SampleAtlasParametersWriter.class));
    }

    /**
     * Create a pipeline that reads and writes NRRD images and resamples on its own thread pool.
     */
    public static AtlasRegistrationPipeline create(ApplicationConfig applicationConfig, RegistrationEngine engine) {
        AtlasRegistrationSettings settings = new AtlasRegistrationSettings(applicationConfig);
        return new AtlasRegistrationPipeline(settings,
                engine,
                new NrrdImageStore(settings.isCompressOutput(), LoggerFactory.getLogger(NrrdImageStore.class)),
                ExecutorServiceFactory.createExecutorService("ATLASREG-APPLY", settings.getApplyThreadPoolSize()),
                true,
                LoggerFactory.getLogger(AtlasRegistrationPipeline.class));
    }

    public SampleRegistrationResult run(SampleSpec sample, Path outputDir) {
        return run(sample, outputDir, Collections.emptyList());
    }

    /**
     * @param previousResults step results of an earlier run of the same sample; matching steps are not registered again
     */
    public SampleRegistrationResult run(SampleSpec sample, Path outputDir, List<TransformResult> previousResults) {
        logger.info("Start registration of {}", sample);
        new AtlasSpecValidator(sample.getAtlases()).validateOrThrow(sample);
        RegistrationChain chain = chainResolver.resolve(sample);
        SampleRegistrationResult runResult = new SampleRegistrationResult(sample.getId(), chain);
        registerChain(sample, chain, previousResults, runResult);
        produceOutputs(sample, chain, outputDir, runResult);
        logger.info("Finished registration of {}: {} of {} steps, {} failures",
                sample.getId(), runResult.getStepResults().size(), chain.size(), runResult.getFailures().size());
        return runResult;
    }

    private void registerChain(SampleSpec sample, RegistrationChain chain, List<TransformResult> previousResults,
                               SampleRegistrationResult runResult) {
        WorkingImageCache workingImageCache = new WorkingImageCache();
        ResolutionManager resolutionManager = new ResolutionManager(imageStore, engine, workingImageCache,
                settings.getDownsamplingTolerance(), LoggerFactory.getLogger(ResolutionManager.class));
        try {
            for (RegistrationStep step : chain.getSteps()) {
                Optional<TransformResult> previous = findPreviousResult(previousResults, step);
                if (previous.isPresent()) {
                    logger.info("Reuse the result of step {} for {}", step.getIndex(), sample.getId());
                    runResult.addStepResult(previous.get());
                    continue;
                }
                try {
                    WorkingImages workingImages = resolutionManager.prepare(step);
                    runResult.addStepResult(registrationDriver.run(step, workingImages));
                } catch (AtlasRegistrationException | UncheckedIOException e) {
                    logger.error("Registration of {} stopped at step {}", sample.getId(), step.getIndex(), e);
                    runResult.addFailure(new RunFailure(step.getIndex(), step.getFixed().getId(), null, e));
                    break;
                }
            }
        } finally {
            workingImageCache.clear();
        }
    }

    private Optional<TransformResult> findPreviousResult(List<TransformResult> previousResults, RegistrationStep step) {
        return previousResults.stream()
                .filter(r -> r.getStepIndex() == step.getIndex())
                .filter(r -> r.getStep().getFixed().getId().equals(step.getFixed().getId()))
                .filter(r -> r.getStep().getMoving().getId().equals(step.getMoving().getId()))
                .findFirst();
    }

    private void produceOutputs(SampleSpec sample, RegistrationChain chain, Path outputDir, SampleRegistrationResult runResult) {
        List<TransformResult> stepResults = runResult.getStepResults();
        for (int i = 0; i < stepResults.size(); i++) {
            AtlasSpec level = chain.getStep(i).getFixed();
            boolean finalLevel = i == chain.size() - 1;
            Optional<RegistrationDirection> direction = sample.getDirectionFor(level.getId(), finalLevel);
            if (!direction.isPresent()) {
                continue;
            }
            List<TransformResult> levelResults = stepResults.subList(0, i + 1);
            if (direction.get().includesForward()) {
                produceForwardOutputs(sample, level, levelResults, outputDir, runResult);
            }
            if (direction.get().includesInverse()) {
                produceInverseOutputs(sample, level, finalLevel, levelResults, outputDir, runResult);
            }
        }
    }

    private void produceForwardOutputs(SampleSpec sample, AtlasSpec level, List<TransformResult> levelResults,
                                       Path outputDir, SampleRegistrationResult runResult) {
        int stepIndex = levelResults.size() - 1;
        try {
            ComposedTransform composed = transformComposer.composeForward(levelResults, TransformVariant.FULL);
            saveTransform(level, composed, outputDir, runResult);
            if (settings.isSaveWorkingTransforms()) {
                saveTransform(level, transformComposer.composeForward(levelResults, TransformVariant.WORKING), outputDir, runResult);
            }
            Path imageDir = outputDir.resolve("source-to-" + level.getId());
            ImageGrid sourceGrid = ImageGrid.of(sample.getSource());
            List<ImageTask> tasks = new ArrayList<>();
            tasks.add(imageTask(sample.getSource().getTemplatePath(), ImageKind.INTENSITY, imageDir, sourceGrid));
            for (AssociatedImage image : sample.getAssociatedImages()) {
                tasks.add(imageTask(image.getPath(), image.getKind(), imageDir, sourceGrid));
            }
            runResult.addImageResults(imageApplier.applyAll(composed, tasks));
        } catch (AtlasRegistrationException | UncheckedIOException e) {
            logger.error("Forward outputs of {} in {} space failed", sample.getId(), level.getId(), e);
            runResult.addFailure(new RunFailure(stepIndex, level.getId(), TransformDirection.FORWARD, e));
        }
    }

    private void produceInverseOutputs(SampleSpec sample, AtlasSpec level, boolean finalLevel, List<TransformResult> levelResults,
                                       Path outputDir, SampleRegistrationResult runResult) {
        int stepIndex = levelResults.size() - 1;
        try {
            ComposedTransform composed = transformComposer.composeInverse(levelResults, TransformVariant.FULL);
            saveTransform(level, composed, outputDir, runResult);
            if (settings.isSaveWorkingTransforms()) {
                saveTransform(level, transformComposer.composeInverse(levelResults, TransformVariant.WORKING), outputDir, runResult);
            }
            Path imageDir = outputDir.resolve(level.getId() + "-to-source");
            ImageGrid levelGrid = ImageGrid.of(level);
            ImageTask templateTask = imageTask(level.getTemplatePath(), ImageKind.INTENSITY, imageDir, levelGrid);
            List<ImageTask> annotationTasks = new ArrayList<>();
            for (AssociatedImage annotation : level.getAnnotationImages()) {
                annotationTasks.add(imageTask(annotation.getPath(), annotation.getKind(), imageDir, levelGrid));
            }
            List<ImageTask> tasks = new ArrayList<>();
            tasks.add(templateTask);
            tasks.addAll(annotationTasks);
            List<ImageTaskResult> results = imageApplier.applyAll(composed, tasks);
            runResult.addImageResults(results);

            List<Path> copiedTrees = new ArrayList<>();
            for (Path structureTree : level.getStructureTreePaths()) {
                copiedTrees.add(FileUtils.copyWithPrefix(structureTree, imageDir, ""));
            }
            boolean annotationsDone = results.stream().skip(1).allMatch(ImageTaskResult::isSuccessful);
            if (finalLevel && annotationsDone && sample.getTargetParametersOutput().isPresent()) {
                List<Path> transformedAnnotations = new ArrayList<>();
                annotationTasks.forEach(t -> transformedAnnotations.add(t.getOutput()));
                sampleAtlasParametersWriter.write(sample, transformedAnnotations, copiedTrees, sample.getTargetParametersOutput().get());
            }
        } catch (NoInverseAvailableException e) {
            logger.warn("No inverse outputs of {} in {} space: {}", level.getId(), sample.getId(), e.getMessage());
            runResult.addFailure(new RunFailure(stepIndex, level.getId(), TransformDirection.INVERSE, e));
        } catch (AtlasRegistrationException | UncheckedIOException e) {
            logger.error("Inverse outputs of {} in {} space failed", level.getId(), sample.getId(), e);
            runResult.addFailure(new RunFailure(stepIndex, level.getId(), TransformDirection.INVERSE, e));
        }
    }

    private ImageTask imageTask(Path input, ImageKind kind, Path imageDir, ImageGrid ownerGrid) {
        return new ImageTask(input, kind, FileUtils.getFilePath(imageDir, "", input, settings.getImageExtension()), ownerGrid);
    }

    private void saveTransform(AtlasSpec level, ComposedTransform composed, Path outputDir, SampleRegistrationResult runResult) {
        String name = level.getId() + "-" + composed.getDirection().name().toLowerCase() + "-" + composed.getVariant().name().toLowerCase();
        transformStore.write(composed, outputDir.resolve(TRANSFORMS_DIR).resolve(name + ".json"));
        runResult.addComposedTransform(name, composed);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            ExecutorServiceFactory.shutdownExecutor(executorService);
        }
    }
}
