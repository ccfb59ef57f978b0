package org.janelia.spatialnorm.normalization;

import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class MaskingCaseTest {

    @Test
    public void maskWithExplicitMasking() {
        assertThat(MaskingCase.of(true, true, true), equalTo(MaskingCase.MASKED_IMAGE_WITH_LESION_CFM));
        assertThat(MaskingCase.of(true, true, false), equalTo(MaskingCase.MASKED_IMAGE));
    }

    @Test
    public void maskWithoutExplicitMasking() {
        assertThat(MaskingCase.of(true, false, true), equalTo(MaskingCase.MASK_MINUS_LESION_CFM));
        assertThat(MaskingCase.of(true, false, false), equalTo(MaskingCase.MASK_AS_IS));
    }

    @Test
    public void explicitMaskingIsIgnoredWithoutMask() {
        assertThat(MaskingCase.of(false, true, true), equalTo(MaskingCase.GLOBAL_MINUS_LESION_CFM));
        assertThat(MaskingCase.of(false, false, true), equalTo(MaskingCase.GLOBAL_MINUS_LESION_CFM));
        assertThat(MaskingCase.of(false, true, false), equalTo(MaskingCase.NO_MASKING));
        assertThat(MaskingCase.of(false, false, false), equalTo(MaskingCase.NO_MASKING));
    }

    @Test
    public void onlyExplicitMaskingChangesTheImage() {
        assertTrue(MaskingCase.MASKED_IMAGE.masksImage());
        assertFalse(MaskingCase.MASKED_IMAGE.producesMaskArg());
        assertTrue(MaskingCase.MASKED_IMAGE_WITH_LESION_CFM.producesMaskArg());
        assertFalse(MaskingCase.MASK_AS_IS.masksImage());
        assertFalse(MaskingCase.NO_MASKING.producesMaskArg());
    }
}
