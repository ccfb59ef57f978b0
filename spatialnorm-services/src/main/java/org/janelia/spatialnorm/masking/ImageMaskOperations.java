package org.janelia.spatialnorm.masking;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import jakarta.inject.Inject;

import org.janelia.spatialnorm.exceptions.ConfigurationException;
import org.janelia.spatialnorm.imageio.ImageOrientation;
import org.janelia.spatialnorm.imageio.NiftiDataType;
import org.janelia.spatialnorm.imageio.NiftiHeader;
import org.janelia.spatialnorm.imageio.NiftiImage;
import org.janelia.spatialnorm.imageio.NiftiImageIO;
import org.janelia.spatialnorm.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Voxel level mask operations used to prepare the registration inputs.
 * Images and masks must share the same voxel grid; nothing is resampled and a grid mismatch is a
 * {@link ConfigurationException}.
 */
public class ImageMaskOperations {

    static final String COST_FUNCTION_MASK_SUFFIX = "_cfm";

    private final Logger logger;

    @Inject
    public ImageMaskOperations(Logger logger) {
        this.logger = logger;
    }

    /**
     * Zero every voxel of the image where the mask is 0. The affine and the header of the image are kept.
     *
     * @param inFile image to mask
     * @param maskFile binary mask on the same grid as the image
     * @param outputFile masked image location
     * @return the absolute path of the masked image
     */
    public String applyMask(String inFile, String maskFile, Path outputFile) {
        NiftiImage image = NiftiImageIO.read(Paths.get(inFile));
        NiftiImage mask = NiftiImageIO.read(Paths.get(maskFile));
        checkSameGrid(image, mask, inFile, maskFile);
        double[] maskedData = Arrays.copyOf(image.getData(), image.getData().length);
        double[] maskData = mask.getData();
        for (int i = 0; i < maskedData.length; i++) {
            if (maskData[i] == 0) {
                maskedData[i] = 0;
            }
        }
        Path maskedImagePath = outputFile.toAbsolutePath();
        NiftiImageIO.write(image.withData(maskedData), maskedImagePath);
        logger.debug("Masked {} with {} -> {}", inFile, maskFile, maskedImagePath);
        return maskedImagePath.toString();
    }

    /**
     * Create a cost function mask named after the input file, with the given prefix and the "_cfm" suffix,
     * in the output directory.
     *
     * @see #createCostFunctionMaskFile(String, String, boolean, Path)
     */
    public String createCostFunctionMask(String inFile, String lesionMask, boolean globalMask, Path outputDir, String namePrefix) {
        Path cfmPath = FileUtils.getFilePath(outputDir, namePrefix, inFile, COST_FUNCTION_MASK_SUFFIX, null);
        return createCostFunctionMaskFile(inFile, lesionMask, globalMask, cfmPath);
    }

    /**
     * @return true if the lesion mask, once reoriented to closest canonical, has the voxel grid of the image
     */
    public boolean isOnSameGrid(String imageFile, String lesionMask) {
        NiftiImage image = NiftiImageIO.read(Paths.get(imageFile));
        NiftiImage lesionImage = ImageOrientation.toClosestCanonical(NiftiImageIO.read(Paths.get(lesionMask)));
        return image.hasSameShape(lesionImage);
    }

    /**
     * Create a binary mask that restricts the voxels used by the registration metric.
     *
     * @param inFile reference image. If globalMask is set only its grid is used, otherwise it must be a binary mask
     * @param lesionMask optional binary lesion mask subtracted from the base mask
     * @param globalMask start from a mask that is 1 everywhere instead of the reference's own voxels
     * @param cfmPath output location
     * @return the absolute path of the cost function mask
     */
    public String createCostFunctionMaskFile(String inFile, String lesionMask, boolean globalMask, Path cfmPath) {
        if (!globalMask && lesionMask == null) {
            logger.warn("No lesion mask was provided and global mask not requested, therefore the original mask will not be modified.");
        }
        NiftiImage referenceImage = NiftiImageIO.read(Paths.get(inFile));
        double[] cfmData;
        if (globalMask) {
            cfmData = new double[referenceImage.getData().length];
            Arrays.fill(cfmData, 1);
        } else {
            cfmData = Arrays.copyOf(referenceImage.getData(), referenceImage.getData().length);
            if (!isBinary(cfmData)) {
                throw new ConfigurationException("Global mask must be requested if " + inFile + " is not a binary mask");
            }
        }
        if (lesionMask != null) {
            NiftiImage lesionImage = ImageOrientation.toClosestCanonical(NiftiImageIO.read(Paths.get(lesionMask)));
            checkSameGrid(referenceImage, lesionImage, inFile, lesionMask);
            double[] lesionData = lesionImage.getData();
            for (int i = 0; i < cfmData.length; i++) {
                cfmData[i] = Math.max(cfmData[i] - lesionData[i], 0);
            }
        }
        for (int i = 0; i < cfmData.length; i++) {
            // the uint8 cast truncates fractional values; the mask stays within {0, 1}
            cfmData[i] = Math.floor(Math.min(cfmData[i], 1));
        }
        NiftiImage cfmImage = referenceImage.withData(cfmData);
        NiftiHeader cfmHeader = cfmImage.getHeader();
        cfmHeader.setDataType(NiftiDataType.UINT8);
        cfmHeader.setScaling(1, 0);
        Path absoluteCfmPath = cfmPath.toAbsolutePath();
        NiftiImageIO.write(cfmImage, absoluteCfmPath);
        logger.debug("Created cost function mask {} from {} (lesion: {}, global: {})", absoluteCfmPath, inFile, lesionMask, globalMask);
        return absoluteCfmPath.toString();
    }

    private boolean isBinary(double[] data) {
        return Arrays.stream(data).allMatch(v -> v == 0 || v == 1);
    }

    private void checkSameGrid(NiftiImage image, NiftiImage mask, String imageName, String maskName) {
        if (!image.hasSameShape(mask)) {
            throw new ConfigurationException(imageName + " with shape " + Arrays.toString(image.getShape()) + " and "
                    + maskName + " with shape " + Arrays.toString(mask.getShape()) + " are not on the same voxel grid");
        }
    }
}
