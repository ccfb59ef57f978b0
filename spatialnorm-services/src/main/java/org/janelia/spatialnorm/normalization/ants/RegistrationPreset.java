package org.janelia.spatialnorm.normalization.ants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * antsRegistration parameters read from a preset file. Per stage values are indexed by the position
 * of the stage in {@link #getTransforms()}; a stage may combine several metrics, which is why the metric
 * related values are lists of lists.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegistrationPreset {

    private int dimension = 3;
    private List<String> transforms = new ArrayList<>();
    private List<List<Double>> transformParameters = new ArrayList<>();
    private List<List<Integer>> numberOfIterations = new ArrayList<>();
    private List<Double> convergenceThreshold = new ArrayList<>();
    private List<Integer> convergenceWindowSize = new ArrayList<>();
    private List<List<String>> metric = new ArrayList<>();
    private List<List<Double>> metricWeight = new ArrayList<>();
    private List<List<Integer>> radiusOrNumberOfBins = new ArrayList<>();
    private List<List<String>> samplingStrategy = new ArrayList<>();
    private List<List<Double>> samplingPercentage = new ArrayList<>();
    private List<List<Double>> smoothingSigmas = new ArrayList<>();
    private List<String> sigmaUnits = new ArrayList<>();
    private List<List<Integer>> shrinkFactors = new ArrayList<>();
    private List<Boolean> useHistogramMatching = new ArrayList<>();
    private String interpolation;
    private Double winsorizeLowerQuantile;
    private Double winsorizeUpperQuantile;
    private boolean collapseOutputTransforms = true;
    private boolean initializeTransformsPerStage;
    private String outputTransformPrefix = "transform";
    private boolean outputWarpedImage;
    private boolean outputInverseWarpedImage;
    private boolean verbose;

    @JsonIgnore
    public int getNumberOfStages() {
        return CollectionUtils.size(transforms);
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public List<String> getTransforms() {
        return transforms;
    }

    public void setTransforms(List<String> transforms) {
        this.transforms = transforms;
    }

    public List<List<Double>> getTransformParameters() {
        return transformParameters;
    }

    public void setTransformParameters(List<List<Double>> transformParameters) {
        this.transformParameters = transformParameters;
    }

    public List<List<Integer>> getNumberOfIterations() {
        return numberOfIterations;
    }

    public void setNumberOfIterations(List<List<Integer>> numberOfIterations) {
        this.numberOfIterations = numberOfIterations;
    }

    public List<Double> getConvergenceThreshold() {
        return convergenceThreshold;
    }

    public void setConvergenceThreshold(List<Double> convergenceThreshold) {
        this.convergenceThreshold = convergenceThreshold;
    }

    public List<Integer> getConvergenceWindowSize() {
        return convergenceWindowSize;
    }

    public void setConvergenceWindowSize(List<Integer> convergenceWindowSize) {
        this.convergenceWindowSize = convergenceWindowSize;
    }

    public List<List<String>> getMetric() {
        return metric;
    }

    public void setMetric(List<List<String>> metric) {
        this.metric = metric;
    }

    public List<List<Double>> getMetricWeight() {
        return metricWeight;
    }

    public void setMetricWeight(List<List<Double>> metricWeight) {
        this.metricWeight = metricWeight;
    }

    public List<List<Integer>> getRadiusOrNumberOfBins() {
        return radiusOrNumberOfBins;
    }

    public void setRadiusOrNumberOfBins(List<List<Integer>> radiusOrNumberOfBins) {
        this.radiusOrNumberOfBins = radiusOrNumberOfBins;
    }

    public List<List<String>> getSamplingStrategy() {
        return samplingStrategy;
    }

    public void setSamplingStrategy(List<List<String>> samplingStrategy) {
        this.samplingStrategy = samplingStrategy;
    }

    public List<List<Double>> getSamplingPercentage() {
        return samplingPercentage;
    }

    public void setSamplingPercentage(List<List<Double>> samplingPercentage) {
        this.samplingPercentage = samplingPercentage;
    }

    public List<List<Double>> getSmoothingSigmas() {
        return smoothingSigmas;
    }

    public void setSmoothingSigmas(List<List<Double>> smoothingSigmas) {
        this.smoothingSigmas = smoothingSigmas;
    }

    public List<String> getSigmaUnits() {
        return sigmaUnits;
    }

    public void setSigmaUnits(List<String> sigmaUnits) {
        this.sigmaUnits = sigmaUnits;
    }

    public List<List<Integer>> getShrinkFactors() {
        return shrinkFactors;
    }

    public void setShrinkFactors(List<List<Integer>> shrinkFactors) {
        this.shrinkFactors = shrinkFactors;
    }

    /**
     * @return either a single value used by all stages or one value per stage
     */
    public List<Boolean> getUseHistogramMatching() {
        return useHistogramMatching;
    }

    public void setUseHistogramMatching(List<Boolean> useHistogramMatching) {
        this.useHistogramMatching = useHistogramMatching;
    }

    /**
     * Set the same histogram matching flag for every stage.
     */
    public void overrideHistogramMatching(boolean enabled) {
        this.useHistogramMatching = new ArrayList<>(Collections.nCopies(Math.max(getNumberOfStages(), 1), enabled));
    }

    public boolean isHistogramMatchingUsedAtStage(int stage) {
        if (CollectionUtils.isEmpty(useHistogramMatching)) {
            return false;
        } else if (useHistogramMatching.size() == 1) {
            return Boolean.TRUE.equals(useHistogramMatching.get(0));
        } else {
            return Boolean.TRUE.equals(useHistogramMatching.get(stage));
        }
    }

    public String getInterpolation() {
        return interpolation;
    }

    public void setInterpolation(String interpolation) {
        this.interpolation = interpolation;
    }

    public Double getWinsorizeLowerQuantile() {
        return winsorizeLowerQuantile;
    }

    public void setWinsorizeLowerQuantile(Double winsorizeLowerQuantile) {
        this.winsorizeLowerQuantile = winsorizeLowerQuantile;
    }

    public Double getWinsorizeUpperQuantile() {
        return winsorizeUpperQuantile;
    }

    public void setWinsorizeUpperQuantile(Double winsorizeUpperQuantile) {
        this.winsorizeUpperQuantile = winsorizeUpperQuantile;
    }

    public boolean isCollapseOutputTransforms() {
        return collapseOutputTransforms;
    }

    public void setCollapseOutputTransforms(boolean collapseOutputTransforms) {
        this.collapseOutputTransforms = collapseOutputTransforms;
    }

    public boolean isInitializeTransformsPerStage() {
        return initializeTransformsPerStage;
    }

    public void setInitializeTransformsPerStage(boolean initializeTransformsPerStage) {
        this.initializeTransformsPerStage = initializeTransformsPerStage;
    }

    public String getOutputTransformPrefix() {
        return outputTransformPrefix;
    }

    public void setOutputTransformPrefix(String outputTransformPrefix) {
        this.outputTransformPrefix = outputTransformPrefix;
    }

    public boolean isOutputWarpedImage() {
        return outputWarpedImage;
    }

    public void setOutputWarpedImage(boolean outputWarpedImage) {
        this.outputWarpedImage = outputWarpedImage;
    }

    public boolean isOutputInverseWarpedImage() {
        return outputInverseWarpedImage;
    }

    public void setOutputInverseWarpedImage(boolean outputInverseWarpedImage) {
        this.outputInverseWarpedImage = outputInverseWarpedImage;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }
}
