package org.janelia.spatialnorm.normalization;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.janelia.spatialnorm.exceptions.ConfigurationException;
import org.janelia.spatialnorm.exceptions.MissingDataException;
import org.janelia.spatialnorm.masking.ImageMaskOperations;
import org.janelia.spatialnorm.templates.ResolvedTemplate;
import org.janelia.spatialnorm.templates.TemplateResolver;
import org.janelia.spatialnorm.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Computes the images and masks passed to every registration attempt of a job. Masked images and cost function
 * masks are written to the job's working directory.
 */
public class RegistrationInputsResolver {

    static final String MOVING_MASKED_IMAGE = "moving_masked.nii.gz";
    static final String FIXED_MASKED_IMAGE = "fixed_masked.nii.gz";
    static final String MOVING_CFM_PREFIX = "moving_";
    static final String FIXED_CFM_PREFIX = "fixed_";

    private final ImageMaskOperations imageMaskOperations;
    private final TemplateResolver templateResolver;
    private final Logger logger;

    @Inject
    public RegistrationInputsResolver(ImageMaskOperations imageMaskOperations, TemplateResolver templateResolver, Logger logger) {
        this.imageMaskOperations = imageMaskOperations;
        this.templateResolver = templateResolver;
        this.logger = logger;
    }

    public RegistrationInputs resolveInputs(RegistrationJob job, Path workingDir) {
        if (!job.hasReferenceImage() && job.getOrientation() == TemplateOrientation.LAS) {
            throw new ConfigurationException("Template orientation " + job.getOrientation() + " is not yet implemented");
        }
        String movingImage = checkedInputPath(job.getMovingImage(), "moving image");
        String movingMask = checkedInputPath(job.getMovingMask(), "moving mask");
        String lesionMask = checkedInputPath(job.getLesionMask(), "lesion mask");

        MaskingCase movingMaskingCase = MaskingCase.of(movingMask != null, job.isExplicitMasking(), lesionMask != null);
        logger.debug("Moving image masking: {}", movingMaskingCase);
        Pair<String, String> movingInputs = applyMaskingCase(movingMaskingCase,
                movingImage, movingMask, lesionMask, workingDir.resolve(MOVING_MASKED_IMAGE), workingDir, MOVING_CFM_PREFIX);

        RegistrationInputs.Builder inputsBuilder = RegistrationInputs.builder()
                .movingImage(movingInputs.getLeft())
                .movingImageMask(movingInputs.getRight())
                .initialMovingTransform(job.getInitialMovingTransform() == null ? null : toAbsolutePath(job.getInitialMovingTransform()))
                .numThreads(job.getNumThreads())
                .useFloat(job.isUseFloat());
        if (job.hasReferenceImage()) {
            resolveReferenceImageInputs(job, lesionMask, workingDir, inputsBuilder);
        } else {
            resolveTemplateInputs(job, lesionMask, workingDir, inputsBuilder);
        }
        RegistrationInputs inputs = inputsBuilder.build();
        logger.info("Resolved registration inputs {}", inputs);
        return inputs;
    }

    private void resolveReferenceImageInputs(RegistrationJob job, String lesionMask, Path workingDir, RegistrationInputs.Builder inputsBuilder) {
        String referenceImage = checkedInputPath(job.getReferenceImage(), "reference image");
        String referenceMask = checkedInputPath(job.getReferenceMask(), "reference mask");
        MaskingCase fixedMaskingCase = MaskingCase.of(referenceMask != null, job.isExplicitMasking(), lesionMask != null);
        logger.debug("Reference image masking: {}", fixedMaskingCase);
        Pair<String, String> fixedInputs = applyMaskingCase(fixedMaskingCase,
                referenceImage, referenceMask, fixedGridLesion(referenceImage, lesionMask),
                workingDir.resolve(FIXED_MASKED_IMAGE), workingDir, FIXED_CFM_PREFIX);
        inputsBuilder
                .referenceImage(referenceImage)
                .fixedImage(fixedInputs.getLeft())
                .fixedImageMask(fixedInputs.getRight());
    }

    private void resolveTemplateInputs(RegistrationJob job, String lesionMask, Path workingDir, RegistrationInputs.Builder inputsBuilder) {
        Map<String, String> templateSpec = new LinkedHashMap<>(job.getTemplateSpec());
        int defaultResolution = job.getFlavor().getDefaultTemplateResolution();
        if (job.getTemplateResolution() != null) {
            logger.warn("The use of template resolution is deprecated - set the resolution in the template spec instead");
            templateSpec.put("res", String.valueOf(job.getTemplateResolution()));
        }
        templateSpec.put("suffix", job.getReference().getValue());
        templateSpec.put("desc", null);
        ResolvedTemplate resolvedTemplate = templateResolver.getTemplateSpecs(job.getTemplate(), templateSpec, defaultResolution, true);
        String templateImage = resolvedTemplate.getImage().toString();
        if (FileUtils.fileNotExists(templateImage)) {
            throw new MissingDataException("The registration reference must be an existing file, but path \""
                    + templateImage + "\" cannot be found.");
        }
        String templateMask = lookupTemplateBrainMask(job.getTemplate(), resolvedTemplate.getSpec());

        String fixedImage;
        String fixedImageMask;
        if (job.isExplicitMasking()) {
            fixedImage = imageMaskOperations.applyMask(templateImage, templateMask, workingDir.resolve(FIXED_MASKED_IMAGE));
            if (lesionMask != null) {
                fixedImageMask = imageMaskOperations.createCostFunctionMask(templateMask,
                        fixedGridLesion(templateMask, lesionMask), true, workingDir, FIXED_CFM_PREFIX);
            } else {
                fixedImageMask = null;
            }
        } else {
            fixedImage = templateImage;
            fixedImageMask = templateMask;
        }
        inputsBuilder
                .referenceImage(fixedImage)
                .fixedImage(fixedImage)
                .fixedImageMask(fixedImageMask);
    }

    private String lookupTemplateBrainMask(String templateId, Map<String, String> templateSpec) {
        Map<String, String> descBrainSpec = new LinkedHashMap<>(templateSpec);
        descBrainSpec.put("desc", "brain");
        descBrainSpec.put("suffix", "mask");
        List<Path> brainMasks = templateResolver.getTemplate(templateId, descBrainSpec);
        if (brainMasks.isEmpty()) {
            Map<String, String> labelBrainSpec = new LinkedHashMap<>(templateSpec);
            labelBrainSpec.put("label", "brain");
            labelBrainSpec.put("suffix", "mask");
            brainMasks = templateResolver.getTemplate(templateId, labelBrainSpec);
        }
        if (brainMasks.isEmpty()) {
            throw new MissingDataException("No brain mask found for template " + templateId + " " + templateSpec);
        } else if (brainMasks.size() > 1) {
            throw new MissingDataException("Brain mask for template " + templateId + " " + templateSpec + " is ambiguous: " + brainMasks);
        }
        return brainMasks.get(0).toAbsolutePath().toString();
    }

    /**
     * The lesion mask is given in the moving image space. It is subtracted on the fixed side only if it is on the
     * fixed voxel grid, otherwise the fixed cost function mask is a plain global mask.
     */
    private String fixedGridLesion(String fixedGridImage, String lesionMask) {
        if (lesionMask == null || imageMaskOperations.isOnSameGrid(fixedGridImage, lesionMask)) {
            return lesionMask;
        }
        logger.warn("Lesion mask {} is not on the voxel grid of {} - it will not be subtracted from the fixed mask",
                lesionMask, fixedGridImage);
        return null;
    }

    /**
     * Decision procedure shared by the moving and the reference side.
     *
     * @return the image to register and the cost function mask argument (which may be null)
     */
    private Pair<String, String> applyMaskingCase(MaskingCase maskingCase,
                                                  String image,
                                                  String mask,
                                                  String lesionMask,
                                                  Path maskedImagePath,
                                                  Path workingDir,
                                                  String cfmPrefix) {
        String registeredImage = maskingCase.masksImage()
                ? imageMaskOperations.applyMask(image, mask, maskedImagePath)
                : image;
        if (!maskingCase.producesMaskArg()) {
            return ImmutablePair.of(registeredImage, null);
        }
        switch (maskingCase) {
            case MASKED_IMAGE_WITH_LESION_CFM:
                return ImmutablePair.of(registeredImage, imageMaskOperations.createCostFunctionMask(mask, lesionMask, true, workingDir, cfmPrefix));
            case MASK_MINUS_LESION_CFM:
                return ImmutablePair.of(registeredImage, imageMaskOperations.createCostFunctionMask(mask, lesionMask, false, workingDir, cfmPrefix));
            case MASK_AS_IS:
                return ImmutablePair.of(registeredImage, mask);
            case GLOBAL_MINUS_LESION_CFM:
                return ImmutablePair.of(registeredImage, imageMaskOperations.createCostFunctionMask(image, lesionMask, true, workingDir, cfmPrefix));
            default:
                throw new IllegalStateException("Unhandled masking case " + maskingCase);
        }
    }

    private String checkedInputPath(String inputPath, String inputName) {
        if (inputPath == null) {
            return null;
        }
        if (FileUtils.fileNotExists(inputPath)) {
            throw new MissingDataException("The " + inputName + " " + inputPath + " does not exist");
        }
        return toAbsolutePath(inputPath);
    }

    private String toAbsolutePath(String p) {
        return Paths.get(p).toAbsolutePath().toString();
    }
}
