package org.janelia.spatialnorm.normalization.ants;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.collections4.CollectionUtils;
import org.janelia.spatialnorm.exceptions.ConfigurationException;
import org.slf4j.Logger;

public class RegistrationPresetLoader {

    private final ObjectMapper objectMapper;
    private final Logger logger;

    @Inject
    public RegistrationPresetLoader(ObjectMapper objectMapper, Logger logger) {
        this.objectMapper = objectMapper;
        this.logger = logger;
    }

    /**
     * Read and validate a preset file.
     *
     * @throws ConfigurationException if the file cannot be parsed or the per stage values are inconsistent
     */
    public RegistrationPreset load(Path presetFile) {
        logger.debug("Read registration preset from {}", presetFile);
        RegistrationPreset preset;
        try (InputStream presetStream = Files.newInputStream(presetFile)) {
            preset = objectMapper.readValue(presetStream, RegistrationPreset.class);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading registration preset " + presetFile, e);
        }
        validate(preset, presetFile);
        return preset;
    }

    private void validate(RegistrationPreset preset, Path presetFile) {
        int nStages = preset.getNumberOfStages();
        if (nStages == 0) {
            throw new ConfigurationException("No transforms defined in " + presetFile);
        }
        checkStageValues("transform_parameters", preset.getTransformParameters(), nStages, true, presetFile);
        checkStageValues("number_of_iterations", preset.getNumberOfIterations(), nStages, true, presetFile);
        checkStageValues("convergence_threshold", preset.getConvergenceThreshold(), nStages, true, presetFile);
        checkStageValues("convergence_window_size", preset.getConvergenceWindowSize(), nStages, true, presetFile);
        checkStageValues("metric", preset.getMetric(), nStages, true, presetFile);
        checkStageValues("metric_weight", preset.getMetricWeight(), nStages, true, presetFile);
        checkStageValues("radius_or_number_of_bins", preset.getRadiusOrNumberOfBins(), nStages, true, presetFile);
        checkStageValues("sampling_strategy", preset.getSamplingStrategy(), nStages, false, presetFile);
        checkStageValues("sampling_percentage", preset.getSamplingPercentage(), nStages, false, presetFile);
        checkStageValues("smoothing_sigmas", preset.getSmoothingSigmas(), nStages, true, presetFile);
        checkStageValues("sigma_units", preset.getSigmaUnits(), nStages, true, presetFile);
        checkStageValues("shrink_factors", preset.getShrinkFactors(), nStages, true, presetFile);
        int nHistogramMatchingValues = CollectionUtils.size(preset.getUseHistogramMatching());
        if (nHistogramMatchingValues > 1 && nHistogramMatchingValues != nStages) {
            throw new ConfigurationException("use_histogram_matching must have a single value or one value per stage in " + presetFile);
        }
        for (int stage = 0; stage < nStages; stage++) {
            int nMetrics = CollectionUtils.size(preset.getMetric().get(stage));
            if (CollectionUtils.size(preset.getMetricWeight().get(stage)) != nMetrics
                    || CollectionUtils.size(preset.getRadiusOrNumberOfBins().get(stage)) != nMetrics) {
                throw new ConfigurationException("Stage " + stage + " metric settings are inconsistent in " + presetFile);
            }
        }
    }

    private void checkStageValues(String name, List<?> values, int nStages, boolean required, Path presetFile) {
        int nValues = CollectionUtils.size(values);
        if (nValues == 0 && !required) {
            return;
        }
        if (nValues != nStages) {
            throw new ConfigurationException(String.format("%s has %d values but %d stages are defined in %s",
                    name, nValues, nStages, presetFile));
        }
    }
}
