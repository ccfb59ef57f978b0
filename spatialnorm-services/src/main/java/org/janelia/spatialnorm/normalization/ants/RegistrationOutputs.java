package org.janelia.spatialnorm.normalization.ants;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Files produced by a successful registration. Any of them may be null if the engine was not asked to produce it
 * or did not write it.
 */
public class RegistrationOutputs {

    private final String compositeTransform;
    private final String inverseCompositeTransform;
    private final String warpedImage;
    private final String inverseWarpedImage;
    private final String referenceImage;

    public RegistrationOutputs(String compositeTransform,
                               String inverseCompositeTransform,
                               String warpedImage,
                               String inverseWarpedImage,
                               String referenceImage) {
        this.compositeTransform = compositeTransform;
        this.inverseCompositeTransform = inverseCompositeTransform;
        this.warpedImage = warpedImage;
        this.inverseWarpedImage = inverseWarpedImage;
        this.referenceImage = referenceImage;
    }

    @JsonProperty("composite_transform")
    public String getCompositeTransform() {
        return compositeTransform;
    }

    @JsonProperty("inverse_composite_transform")
    public String getInverseCompositeTransform() {
        return inverseCompositeTransform;
    }

    @JsonProperty("warped_image")
    public String getWarpedImage() {
        return warpedImage;
    }

    @JsonProperty("inverse_warped_image")
    public String getInverseWarpedImage() {
        return inverseWarpedImage;
    }

    @JsonProperty("reference_image")
    public String getReferenceImage() {
        return referenceImage;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }
}
