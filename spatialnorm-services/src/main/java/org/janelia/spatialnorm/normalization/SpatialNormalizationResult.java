package org.janelia.spatialnorm.normalization;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.spatialnorm.normalization.ants.RegistrationOutputs;

public class SpatialNormalizationResult {

    private final RegistrationOutputs outputs;
    private final String referenceImage;
    private final int attempts;
    private final List<String> failureLogs;

    public SpatialNormalizationResult(RegistrationOutputs outputs, String referenceImage, int attempts, List<String> failureLogs) {
        this.outputs = outputs;
        this.referenceImage = referenceImage;
        this.attempts = attempts;
        this.failureLogs = ImmutableList.copyOf(failureLogs);
    }

    @JsonProperty("outputs")
    public RegistrationOutputs getOutputs() {
        return outputs;
    }

    /**
     * @return the reference image the moving image was registered to, either the supplied one or the resolved template
     */
    @JsonProperty("reference_image")
    public String getReferenceImage() {
        return referenceImage;
    }

    /**
     * @return the number of presets tried, including the successful one
     */
    @JsonProperty("attempts")
    public int getAttempts() {
        return attempts;
    }

    @JsonProperty("failure_logs")
    public List<String> getFailureLogs() {
        return failureLogs;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }
}
