package org.janelia.spatialnorm.normalization.ants;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import jakarta.inject.Inject;

import com.google.common.collect.ImmutableList;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spatialnorm.cdi.qualifier.PropertyValue;
import org.janelia.spatialnorm.cdi.qualifier.StrPropertyValue;
import org.janelia.spatialnorm.normalization.RegistrationInputs;
import org.janelia.spatialnorm.process.ExternalCommand;

/**
 * Builds the ANTs command lines and locates the files they produce.
 */
public class AntsCommandFactory {

    public static final String THREADS_ENV_VAR = "ITK_GLOBAL_DEFAULT_NUMBER_OF_THREADS";
    public static final String INITIAL_TRANSFORM_FILE = "transform.mat";

    private static final String NULL_MASK = "NULL";
    private static final String WARPED_IMAGE_SUFFIX = "Warped.nii.gz";
    private static final String INVERSE_WARPED_IMAGE_SUFFIX = "InverseWarped.nii.gz";
    private static final String COMPOSITE_TRANSFORM_SUFFIX = "Composite.h5";
    private static final String INVERSE_COMPOSITE_TRANSFORM_SUFFIX = "InverseComposite.h5";

    private final String registrationExecutable;
    private final String affineInitializerExecutable;

    @Inject
    public AntsCommandFactory(@PropertyValue(name = "ANTs.Path") String antsPath,
                              @StrPropertyValue(name = "ANTs.Registration.Executable", defaultValue = "antsRegistration") String registrationExecutable,
                              @StrPropertyValue(name = "ANTs.AffineInitializer.Executable", defaultValue = "antsAffineInitializer") String affineInitializerExecutable) {
        this.registrationExecutable = getExecutablePath(antsPath, registrationExecutable);
        this.affineInitializerExecutable = getExecutablePath(antsPath, affineInitializerExecutable);
    }

    private String getExecutablePath(String antsPath, String executable) {
        if (StringUtils.isBlank(antsPath)) {
            return executable;
        } else {
            return Paths.get(antsPath, executable).toString();
        }
    }

    /**
     * Coarse affine initialization that writes {@link #INITIAL_TRANSFORM_FILE} in the working directory.
     */
    public ExternalCommand createAffineInitializerCommand(String fixedImage, String movingImage, int numThreads) {
        return ExternalCommand.builder(affineInitializerExecutable)
                .addArgs("3", fixedImage, movingImage, INITIAL_TRANSFORM_FILE)
                .addArgs("15.000000", "0.100000", "0", "10")
                .setEnv(THREADS_ENV_VAR, String.valueOf(numThreads))
                .build();
    }

    public ExternalCommand createRegistrationCommand(RegistrationPreset preset, RegistrationInputs inputs) {
        ExternalCommand.Builder cmdBuilder = ExternalCommand.builder(registrationExecutable)
                .addArgs("--collapse-output-transforms", toFlag(preset.isCollapseOutputTransforms()))
                .addArgs("--dimensionality", String.valueOf(preset.getDimension()))
                .addArgs("--float", toFlag(inputs.isUseFloat()));
        if (StringUtils.isNotBlank(inputs.getInitialMovingTransform())) {
            cmdBuilder.addArgs("--initial-moving-transform", "[ " + inputs.getInitialMovingTransform() + ", 0 ]");
        }
        cmdBuilder.addArgs("--initialize-transforms-per-stage", toFlag(preset.isInitializeTransformsPerStage()));
        if (StringUtils.isNotBlank(preset.getInterpolation())) {
            cmdBuilder.addArgs("--interpolation", preset.getInterpolation());
        }
        cmdBuilder.addArgs("--output", formatOutput(preset));
        for (int stage = 0; stage < preset.getNumberOfStages(); stage++) {
            addStageArgs(cmdBuilder, preset, inputs, stage);
        }
        if (preset.getWinsorizeLowerQuantile() != null && preset.getWinsorizeUpperQuantile() != null) {
            cmdBuilder.addArgs("--winsorize-image-intensities",
                    "[ " + formatNumber(preset.getWinsorizeLowerQuantile()) + ", " + formatNumber(preset.getWinsorizeUpperQuantile()) + " ]");
        }
        cmdBuilder.addArgs("--write-composite-transform", toFlag(inputs.isWriteCompositeTransform()));
        if (preset.isVerbose()) {
            cmdBuilder.addArgs("--verbose", "1");
        }
        return cmdBuilder
                .setEnv(THREADS_ENV_VAR, String.valueOf(inputs.getNumThreads()))
                .build();
    }

    private String formatOutput(RegistrationPreset preset) {
        String prefix = preset.getOutputTransformPrefix();
        if (!preset.isOutputWarpedImage()) {
            return prefix;
        }
        ImmutableList.Builder<String> outputs = ImmutableList.<String>builder()
                .add(prefix)
                .add(prefix + WARPED_IMAGE_SUFFIX);
        if (preset.isOutputInverseWarpedImage()) {
            outputs.add(prefix + INVERSE_WARPED_IMAGE_SUFFIX);
        }
        return "[ " + String.join(", ", outputs.build()) + " ]";
    }

    private void addStageArgs(ExternalCommand.Builder cmdBuilder, RegistrationPreset preset, RegistrationInputs inputs, int stage) {
        cmdBuilder.addArgs("--transform",
                preset.getTransforms().get(stage) + "[ " + formatList(preset.getTransformParameters().get(stage), ", ") + " ]");
        List<String> stageMetrics = preset.getMetric().get(stage);
        for (int metricIndex = 0; metricIndex < stageMetrics.size(); metricIndex++) {
            cmdBuilder.addArgs("--metric", formatMetric(preset, inputs, stage, metricIndex));
        }
        cmdBuilder.addArgs("--convergence", String.format("[ %s, %s, %d ]",
                formatList(preset.getNumberOfIterations().get(stage), "x"),
                formatNumber(preset.getConvergenceThreshold().get(stage)),
                preset.getConvergenceWindowSize().get(stage)));
        cmdBuilder.addArgs("--smoothing-sigmas",
                formatList(preset.getSmoothingSigmas().get(stage), "x") + preset.getSigmaUnits().get(stage));
        cmdBuilder.addArgs("--shrink-factors", formatList(preset.getShrinkFactors().get(stage), "x"));
        cmdBuilder.addArgs("--use-histogram-matching", toFlag(preset.isHistogramMatchingUsedAtStage(stage)));
        if (inputs.getFixedImageMask() != null || inputs.getMovingImageMask() != null) {
            cmdBuilder.addArgs("--masks", "[ "
                    + StringUtils.defaultIfBlank(inputs.getFixedImageMask(), NULL_MASK) + ", "
                    + StringUtils.defaultIfBlank(inputs.getMovingImageMask(), NULL_MASK) + " ]");
        }
    }

    private String formatMetric(RegistrationPreset preset, RegistrationInputs inputs, int stage, int metricIndex) {
        ImmutableList.Builder<String> metricArgs = ImmutableList.<String>builder()
                .add(inputs.getFixedImage())
                .add(inputs.getMovingImage())
                .add(formatNumber(preset.getMetricWeight().get(stage).get(metricIndex)))
                .add(formatNumber(preset.getRadiusOrNumberOfBins().get(stage).get(metricIndex)));
        String samplingStrategy = getStageMetricValue(preset.getSamplingStrategy(), stage, metricIndex);
        if (StringUtils.isNotBlank(samplingStrategy)) {
            metricArgs.add(samplingStrategy);
            Double samplingPercentage = getStageMetricValue(preset.getSamplingPercentage(), stage, metricIndex);
            if (samplingPercentage != null) {
                metricArgs.add(formatNumber(samplingPercentage));
            }
        }
        return preset.getMetric().get(stage).get(metricIndex) + "[ " + String.join(", ", metricArgs.build()) + " ]";
    }

    private <T> T getStageMetricValue(List<List<T>> values, int stage, int metricIndex) {
        if (CollectionUtils.size(values) <= stage) {
            return null;
        }
        List<T> stageValues = values.get(stage);
        if (CollectionUtils.size(stageValues) <= metricIndex) {
            return null;
        }
        return stageValues.get(metricIndex);
    }

    /**
     * Find the files written by the registration in the working directory.
     */
    public RegistrationOutputs locateOutputs(RegistrationPreset preset, Path workingDir, String referenceImage) {
        String prefix = preset.getOutputTransformPrefix();
        return new RegistrationOutputs(
                existingFile(workingDir.resolve(prefix + COMPOSITE_TRANSFORM_SUFFIX)),
                existingFile(workingDir.resolve(prefix + INVERSE_COMPOSITE_TRANSFORM_SUFFIX)),
                preset.isOutputWarpedImage() ? existingFile(workingDir.resolve(prefix + WARPED_IMAGE_SUFFIX)) : null,
                preset.isOutputWarpedImage() && preset.isOutputInverseWarpedImage()
                        ? existingFile(workingDir.resolve(prefix + INVERSE_WARPED_IMAGE_SUFFIX))
                        : null,
                referenceImage);
    }

    private String existingFile(Path p) {
        return Files.exists(p) ? p.toAbsolutePath().toString() : null;
    }

    private String toFlag(boolean value) {
        return value ? "1" : "0";
    }

    private String formatList(List<? extends Number> values, String separator) {
        return values.stream().map(this::formatNumber).collect(Collectors.joining(separator));
    }

    private String formatNumber(Number n) {
        if (n instanceof Integer || n instanceof Long) {
            return n.toString();
        }
        return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
    }
}
