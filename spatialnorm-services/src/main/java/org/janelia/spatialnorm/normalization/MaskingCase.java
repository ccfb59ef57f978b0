package org.janelia.spatialnorm.normalization;

/**
 * Masking action selected from the presence of a mask, the explicit masking policy and the presence of a lesion mask.
 * The explicit masking policy is ignored when no mask is given.
 */
public enum MaskingCase {
    /**
     * Zero the image outside the mask and use a global mask minus the lesion as the cost function mask.
     */
    MASKED_IMAGE_WITH_LESION_CFM(true, true),
    /**
     * Zero the image outside the mask and do not pass any cost function mask.
     */
    MASKED_IMAGE(true, false),
    /**
     * Keep the image and use the mask minus the lesion as the cost function mask.
     */
    MASK_MINUS_LESION_CFM(false, true),
    /**
     * Keep the image and use the mask as the cost function mask.
     */
    MASK_AS_IS(false, true),
    /**
     * Keep the image and use a global mask shaped like the image minus the lesion as the cost function mask.
     */
    GLOBAL_MINUS_LESION_CFM(false, true),
    NO_MASKING(false, false);

    private final boolean masksImage;
    private final boolean producesMaskArg;

    MaskingCase(boolean masksImage, boolean producesMaskArg) {
        this.masksImage = masksImage;
        this.producesMaskArg = producesMaskArg;
    }

    public static MaskingCase of(boolean hasMask, boolean explicitMasking, boolean hasLesion) {
        if (hasMask) {
            if (explicitMasking) {
                return hasLesion ? MASKED_IMAGE_WITH_LESION_CFM : MASKED_IMAGE;
            } else {
                return hasLesion ? MASK_MINUS_LESION_CFM : MASK_AS_IS;
            }
        } else {
            return hasLesion ? GLOBAL_MINUS_LESION_CFM : NO_MASKING;
        }
    }

    public boolean masksImage() {
        return masksImage;
    }

    public boolean producesMaskArg() {
        return producesMaskArg;
    }
}
