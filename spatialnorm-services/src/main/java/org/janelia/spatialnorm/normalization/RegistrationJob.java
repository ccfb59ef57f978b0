package org.janelia.spatialnorm.normalization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Configuration of a single spatial normalization request. Instances are immutable.
 */
public class RegistrationJob {

    public static final String DEFAULT_TEMPLATE = "MNI152NLin2009cAsym";

    private final String movingImage;
    private final String referenceImage;
    private final String movingMask;
    private final String referenceMask;
    private final String lesionMask;
    private final boolean explicitMasking;
    private final MovingModality moving;
    private final ReferenceModality reference;
    private final TemplateOrientation orientation;
    private final String template;
    private final Map<String, String> templateSpec;
    private final Integer templateResolution;
    private final RegistrationFlavor flavor;
    private final int numThreads;
    private final boolean useFloat;
    private final String initialMovingTransform;
    private final Boolean useHistogramMatching;
    private final List<String> settings;

    private RegistrationJob(Builder builder) {
        this.movingImage = builder.movingImage;
        this.referenceImage = builder.referenceImage;
        this.movingMask = builder.movingMask;
        this.referenceMask = builder.referenceMask;
        this.lesionMask = builder.lesionMask;
        this.explicitMasking = builder.explicitMasking;
        this.moving = builder.moving;
        this.reference = builder.reference;
        this.orientation = builder.orientation;
        this.template = builder.template;
        // a LinkedHashMap is used because template spec values may be null
        this.templateSpec = Collections.unmodifiableMap(new LinkedHashMap<>(builder.templateSpec));
        this.templateResolution = builder.templateResolution;
        this.flavor = builder.flavor;
        this.numThreads = builder.numThreads;
        this.useFloat = builder.useFloat;
        this.initialMovingTransform = builder.initialMovingTransform;
        this.useHistogramMatching = builder.useHistogramMatching;
        this.settings = builder.settings == null ? null : ImmutableList.copyOf(builder.settings);
    }

    public static Builder builder(String movingImage) {
        return new Builder(movingImage);
    }

    public String getMovingImage() {
        return movingImage;
    }

    public String getReferenceImage() {
        return referenceImage;
    }

    public String getMovingMask() {
        return movingMask;
    }

    public String getReferenceMask() {
        return referenceMask;
    }

    public String getLesionMask() {
        return lesionMask;
    }

    public boolean isExplicitMasking() {
        return explicitMasking;
    }

    public MovingModality getMoving() {
        return moving;
    }

    public ReferenceModality getReference() {
        return reference;
    }

    public TemplateOrientation getOrientation() {
        return orientation;
    }

    public String getTemplate() {
        return template;
    }

    public Map<String, String> getTemplateSpec() {
        return templateSpec;
    }

    /**
     * @deprecated the resolution should be passed in the template spec as "res"
     */
    @Deprecated
    public Integer getTemplateResolution() {
        return templateResolution;
    }

    public RegistrationFlavor getFlavor() {
        return flavor;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public boolean isUseFloat() {
        return useFloat;
    }

    public String getInitialMovingTransform() {
        return initialMovingTransform;
    }

    /**
     * @return the histogram matching override or null to use what each preset specifies
     */
    public Boolean getUseHistogramMatching() {
        return useHistogramMatching;
    }

    /**
     * @return user defined presets or null if none were given
     */
    public List<String> getSettings() {
        return settings;
    }

    public boolean hasReferenceImage() {
        return referenceImage != null;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }

    public static class Builder {
        private final String movingImage;
        private String referenceImage;
        private String movingMask;
        private String referenceMask;
        private String lesionMask;
        private boolean explicitMasking = true;
        private MovingModality moving = MovingModality.T1W;
        private ReferenceModality reference = ReferenceModality.T1W;
        private TemplateOrientation orientation = TemplateOrientation.RAS;
        private String template = DEFAULT_TEMPLATE;
        private final Map<String, String> templateSpec = new LinkedHashMap<>();
        private Integer templateResolution;
        private RegistrationFlavor flavor = RegistrationFlavor.PRECISE;
        private int numThreads = Runtime.getRuntime().availableProcessors();
        private boolean useFloat;
        private String initialMovingTransform;
        private Boolean useHistogramMatching;
        private List<String> settings;

        private Builder(String movingImage) {
            Preconditions.checkArgument(StringUtils.isNotBlank(movingImage), "A moving image is required");
            this.movingImage = movingImage;
        }

        public Builder referenceImage(String referenceImage) {
            this.referenceImage = StringUtils.defaultIfBlank(referenceImage, null);
            return this;
        }

        public Builder movingMask(String movingMask) {
            this.movingMask = StringUtils.defaultIfBlank(movingMask, null);
            return this;
        }

        public Builder referenceMask(String referenceMask) {
            this.referenceMask = StringUtils.defaultIfBlank(referenceMask, null);
            return this;
        }

        public Builder lesionMask(String lesionMask) {
            this.lesionMask = StringUtils.defaultIfBlank(lesionMask, null);
            return this;
        }

        public Builder explicitMasking(boolean explicitMasking) {
            this.explicitMasking = explicitMasking;
            return this;
        }

        public Builder moving(MovingModality moving) {
            this.moving = Preconditions.checkNotNull(moving);
            return this;
        }

        public Builder reference(ReferenceModality reference) {
            this.reference = Preconditions.checkNotNull(reference);
            return this;
        }

        public Builder orientation(TemplateOrientation orientation) {
            this.orientation = Preconditions.checkNotNull(orientation);
            return this;
        }

        public Builder template(String template) {
            this.template = StringUtils.defaultIfBlank(template, DEFAULT_TEMPLATE);
            return this;
        }

        public Builder templateSpec(Map<String, String> templateSpec) {
            this.templateSpec.clear();
            if (templateSpec != null) {
                this.templateSpec.putAll(templateSpec);
            }
            return this;
        }

        public Builder templateResolution(Integer templateResolution) {
            Preconditions.checkArgument(templateResolution == null || templateResolution == 1 || templateResolution == 2,
                    "Template resolution must be 1 or 2");
            this.templateResolution = templateResolution;
            return this;
        }

        public Builder flavor(RegistrationFlavor flavor) {
            this.flavor = Preconditions.checkNotNull(flavor);
            return this;
        }

        public Builder numThreads(int numThreads) {
            Preconditions.checkArgument(numThreads > 0, "The number of threads must be positive");
            this.numThreads = numThreads;
            return this;
        }

        public Builder useFloat(boolean useFloat) {
            this.useFloat = useFloat;
            return this;
        }

        public Builder initialMovingTransform(String initialMovingTransform) {
            this.initialMovingTransform = StringUtils.defaultIfBlank(initialMovingTransform, null);
            return this;
        }

        public Builder useHistogramMatching(Boolean useHistogramMatching) {
            this.useHistogramMatching = useHistogramMatching;
            return this;
        }

        public Builder settings(List<String> settings) {
            this.settings = settings;
            return this;
        }

        public RegistrationJob build() {
            return new RegistrationJob(this);
        }
    }
}
