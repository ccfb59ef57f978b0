package org.janelia.spatialnorm.normalization;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Arguments shared by all registration attempts of a job.
 */
public class RegistrationInputs {

    private final String fixedImage;
    private final String movingImage;
    private final String fixedImageMask;
    private final String movingImageMask;
    private final String initialMovingTransform;
    private final int numThreads;
    private final boolean useFloat;
    private final String referenceImage;

    private RegistrationInputs(Builder builder) {
        this.fixedImage = Preconditions.checkNotNull(builder.fixedImage, "Fixed image is not set");
        this.movingImage = Preconditions.checkNotNull(builder.movingImage, "Moving image is not set");
        this.fixedImageMask = builder.fixedImageMask;
        this.movingImageMask = builder.movingImageMask;
        this.initialMovingTransform = builder.initialMovingTransform;
        this.numThreads = builder.numThreads;
        this.useFloat = builder.useFloat;
        this.referenceImage = Preconditions.checkNotNull(builder.referenceImage, "Reference image is not set");
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFixedImage() {
        return fixedImage;
    }

    public String getMovingImage() {
        return movingImage;
    }

    public String getFixedImageMask() {
        return fixedImageMask;
    }

    public String getMovingImageMask() {
        return movingImageMask;
    }

    public String getInitialMovingTransform() {
        return initialMovingTransform;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public boolean isUseFloat() {
        return useFloat;
    }

    /**
     * The composite transform is always requested so that a single forward and a single inverse transform file
     * are produced regardless of the number of stages.
     */
    public boolean isWriteCompositeTransform() {
        return true;
    }

    public String getReferenceImage() {
        return referenceImage;
    }

    public RegistrationInputs withInitialMovingTransform(String transform) {
        return toBuilder().initialMovingTransform(transform).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .fixedImage(fixedImage)
                .movingImage(movingImage)
                .fixedImageMask(fixedImageMask)
                .movingImageMask(movingImageMask)
                .initialMovingTransform(initialMovingTransform)
                .numThreads(numThreads)
                .useFloat(useFloat)
                .referenceImage(referenceImage);
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }

    public static class Builder {
        private String fixedImage;
        private String movingImage;
        private String fixedImageMask;
        private String movingImageMask;
        private String initialMovingTransform;
        private int numThreads = 1;
        private boolean useFloat;
        private String referenceImage;

        public Builder fixedImage(String fixedImage) {
            this.fixedImage = fixedImage;
            return this;
        }

        public Builder movingImage(String movingImage) {
            this.movingImage = movingImage;
            return this;
        }

        public Builder fixedImageMask(String fixedImageMask) {
            this.fixedImageMask = fixedImageMask;
            return this;
        }

        public Builder movingImageMask(String movingImageMask) {
            this.movingImageMask = movingImageMask;
            return this;
        }

        public Builder initialMovingTransform(String initialMovingTransform) {
            this.initialMovingTransform = initialMovingTransform;
            return this;
        }

        public Builder numThreads(int numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        public Builder useFloat(boolean useFloat) {
            this.useFloat = useFloat;
            return this;
        }

        public Builder referenceImage(String referenceImage) {
            this.referenceImage = referenceImage;
            return this;
        }

        public RegistrationInputs build() {
            return new RegistrationInputs(this);
        }
    }
}
