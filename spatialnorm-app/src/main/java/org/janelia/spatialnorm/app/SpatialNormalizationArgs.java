package org.janelia.spatialnorm.app;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.spatialnorm.exceptions.ConfigurationException;
import org.janelia.spatialnorm.normalization.MovingModality;
import org.janelia.spatialnorm.normalization.ReferenceModality;
import org.janelia.spatialnorm.normalization.RegistrationFlavor;
import org.janelia.spatialnorm.normalization.RegistrationJob;
import org.janelia.spatialnorm.normalization.TemplateOrientation;

public class SpatialNormalizationArgs extends AppArgs {

    /**
     * Reports an unsupported enum value as a command line error.
     */
    abstract static class ValueConverter<T> implements IStringConverter<T> {
        private final Function<String, T> fromValue;

        ValueConverter(Function<String, T> fromValue) {
            this.fromValue = fromValue;
        }

        @Override
        public T convert(String value) {
            try {
                return fromValue.apply(value);
            } catch (ConfigurationException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }

    public static class MovingModalityConverter extends ValueConverter<MovingModality> {
        public MovingModalityConverter() {
            super(MovingModality::fromValue);
        }
    }

    public static class ReferenceModalityConverter extends ValueConverter<ReferenceModality> {
        public ReferenceModalityConverter() {
            super(ReferenceModality::fromValue);
        }
    }

    public static class OrientationConverter extends ValueConverter<TemplateOrientation> {
        public OrientationConverter() {
            super(TemplateOrientation::fromValue);
        }
    }

    public static class FlavorConverter extends ValueConverter<RegistrationFlavor> {
        public FlavorConverter() {
            super(RegistrationFlavor::fromValue);
        }
    }

    @Parameter(names = "-moving", description = "The image to be registered", required = true)
    String movingImage;
    @Parameter(names = "-reference", description = "Reference image; if not set the standard template is used")
    String referenceImage;
    @Parameter(names = "-movingMask", description = "Brain mask of the moving image")
    String movingMask;
    @Parameter(names = "-referenceMask", description = "Brain mask of the reference image")
    String referenceMask;
    @Parameter(names = "-lesionMask", description = "Lesion mask of the moving image, excluded from the cost function")
    String lesionMask;
    @Parameter(names = "-explicitMasking", description = "Zero the images outside their masks instead of passing the masks to the registration", arity = 1)
    boolean explicitMasking = true;
    @Parameter(names = "-movingModality", description = "Moving image modality: T1w or boldref", converter = MovingModalityConverter.class)
    MovingModality movingModality = MovingModality.T1W;
    @Parameter(names = "-referenceModality", description = "Reference modality: T1w, T2w, boldref or PDw", converter = ReferenceModalityConverter.class)
    ReferenceModality referenceModality = ReferenceModality.T1W;
    @Parameter(names = "-orientation", description = "Template orientation: RAS or LAS", converter = OrientationConverter.class)
    TemplateOrientation orientation = TemplateOrientation.RAS;
    @Parameter(names = "-template", description = "Template identifier")
    String template;
    @DynamicParameter(names = "-templateSpec", description = "Template entities, e.g. -templateSpec res=2 -templateSpec cohort=1")
    Map<String, String> templateSpec = new LinkedHashMap<>();
    @Parameter(names = "-templateResolution", description = "Deprecated - use -templateSpec res=<n>")
    Integer templateResolution;
    @Parameter(names = "-flavor", description = "Registration flavor: precise, fast or testing", converter = FlavorConverter.class)
    RegistrationFlavor flavor = RegistrationFlavor.PRECISE;
    @Parameter(names = "-nthreads", description = "Number of ITK threads")
    Integer numThreads;
    @Parameter(names = "-float", description = "Use single precision", arity = 0)
    boolean useFloat = false;
    @Parameter(names = "-initialTransform", description = "Initial moving transform; if not set it is estimated")
    String initialTransform;
    @Parameter(names = "-histogramMatching", description = "Override the histogram matching flag of every preset", arity = 1)
    Boolean histogramMatching;
    @Parameter(names = "-settings", description = "Registration preset files to use instead of the bundled ones")
    List<String> settings = new ArrayList<>();
    @Parameter(names = "-workingDir", description = "Job working directory")
    String workingDir = ".";

    RegistrationJob toRegistrationJob(String defaultTemplate) {
        RegistrationJob.Builder jobBuilder = RegistrationJob.builder(movingImage)
                .referenceImage(referenceImage)
                .movingMask(movingMask)
                .referenceMask(referenceMask)
                .lesionMask(lesionMask)
                .explicitMasking(explicitMasking)
                .moving(movingModality)
                .reference(referenceModality)
                .orientation(orientation)
                .template(StringUtils.defaultIfBlank(template, defaultTemplate))
                .templateSpec(templateSpec)
                .templateResolution(templateResolution)
                .flavor(flavor)
                .useFloat(useFloat)
                .initialMovingTransform(initialTransform)
                .useHistogramMatching(histogramMatching)
                .settings(settings.isEmpty() ? null : settings);
        if (numThreads != null && numThreads > 0) {
            jobBuilder.numThreads(numThreads);
        }
        return jobBuilder.build();
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }
}
