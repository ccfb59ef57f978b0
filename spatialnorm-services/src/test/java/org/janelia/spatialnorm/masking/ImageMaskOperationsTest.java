package org.janelia.spatialnorm.masking;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import org.janelia.spatialnorm.exceptions.ConfigurationException;
import org.janelia.spatialnorm.imageio.NiftiDataType;
import org.janelia.spatialnorm.imageio.NiftiImage;
import org.janelia.spatialnorm.imageio.NiftiImageIO;
import org.janelia.spatialnorm.imageio.TestImages;
import org.janelia.spatialnorm.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class ImageMaskOperationsTest {

    private static final int[] SHAPE = {2, 2, 2};

    @Rule
    public final ExpectedException expectedException = ExpectedException.none();

    private Logger logger;
    private ImageMaskOperations imageMaskOperations;
    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        logger = mock(Logger.class);
        imageMaskOperations = new ImageMaskOperations(logger);
        testDirectory = Files.createTempDirectory("testMasks");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    @Test
    public void applyMaskZeroesVoxelsOutsideTheMask() {
        Path image = TestImages.writeImage(testDirectory.resolve("image.nii.gz"), SHAPE, NiftiDataType.FLOAT32,
                1.5, 2, 3, 4, 5, 6, 7, 8);
        Path mask = TestImages.writeImage(testDirectory.resolve("mask.nii.gz"), SHAPE, NiftiDataType.UINT8,
                1, 0, 1, 0, 0, 1, 1, 0);

        String masked = imageMaskOperations.applyMask(image.toString(), mask.toString(), testDirectory.resolve("masked.nii.gz"));

        assertThat(masked, equalTo(testDirectory.resolve("masked.nii.gz").toAbsolutePath().toString()));
        NiftiImage maskedImage = NiftiImageIO.read(Paths.get(masked));
        assertArrayEquals(new double[] {1.5, 0, 3, 0, 0, 6, 7, 0}, maskedImage.getData(), 0);
        assertThat(maskedImage.getHeader().getDataType(), equalTo(NiftiDataType.FLOAT32));
    }

    @Test
    public void applyMaskIsIdempotent() {
        Path image = TestImages.writeImage(testDirectory.resolve("image.nii.gz"), SHAPE, NiftiDataType.INT16,
                1, 2, 3, 4, 5, 6, 7, 8);
        Path mask = TestImages.writeImage(testDirectory.resolve("mask.nii.gz"), SHAPE, NiftiDataType.UINT8,
                0, 1, 1, 1, 1, 1, 1, 0);

        String maskedOnce = imageMaskOperations.applyMask(image.toString(), mask.toString(), testDirectory.resolve("once.nii.gz"));
        String maskedTwice = imageMaskOperations.applyMask(maskedOnce, mask.toString(), testDirectory.resolve("twice.nii.gz"));

        assertArrayEquals(NiftiImageIO.read(Paths.get(maskedOnce)).getData(), NiftiImageIO.read(Paths.get(maskedTwice)).getData(), 0);
    }

    @Test
    public void applyMaskRequiresTheSameGrid() {
        Path image = TestImages.writeImage(testDirectory.resolve("image.nii.gz"), SHAPE, NiftiDataType.INT16, TestImages.filled(8, 1));
        Path mask = TestImages.writeImage(testDirectory.resolve("mask.nii.gz"), new int[] {2, 2, 1}, NiftiDataType.UINT8, TestImages.filled(4, 1));

        expectedException.expect(ConfigurationException.class);
        imageMaskOperations.applyMask(image.toString(), mask.toString(), testDirectory.resolve("masked.nii.gz"));
    }

    @Test
    public void globalMaskWithoutLesion() {
        Path reference = TestImages.writeImage(testDirectory.resolve("reference.nii.gz"), SHAPE, NiftiDataType.FLOAT32,
                0, 0.5, 100, -3, 7, 8, 9, 10);

        String cfm = imageMaskOperations.createCostFunctionMask(reference.toString(), null, true, testDirectory, null);

        assertThat(cfm, equalTo(testDirectory.resolve("reference_cfm.nii.gz").toAbsolutePath().toString()));
        NiftiImage cfmImage = NiftiImageIO.read(Paths.get(cfm));
        assertThat(cfmImage.getHeader().getDataType(), equalTo(NiftiDataType.UINT8));
        assertArrayEquals(SHAPE, cfmImage.getShape());
        assertArrayEquals(TestImages.filled(8, 1), cfmImage.getData(), 0);
        verify(logger, never()).warn(anyString());
    }

    @Test
    public void lesionIsSubtractedFromTheGlobalMask() {
        Path reference = TestImages.writeImage(testDirectory.resolve("reference.nii.gz"), SHAPE, NiftiDataType.FLOAT32, TestImages.filled(8, 5));
        Path lesion = TestImages.writeImage(testDirectory.resolve("lesion.nii.gz"), SHAPE, NiftiDataType.UINT8,
                0, 0, 1, 1, 0, 0, 0, 1);

        String cfm = imageMaskOperations.createCostFunctionMask(reference.toString(), lesion.toString(), true, testDirectory, null);

        double[] cfmData = NiftiImageIO.read(Paths.get(cfm)).getData();
        assertArrayEquals(new double[] {1, 1, 0, 0, 1, 1, 1, 0}, cfmData, 0);
    }

    @Test
    public void lesionIsSubtractedFromTheBinaryMask() {
        Path referenceMask = TestImages.writeImage(testDirectory.resolve("brainmask.nii.gz"), SHAPE, NiftiDataType.UINT8,
                0, 1, 1, 1, 1, 1, 1, 0);
        Path lesion = TestImages.writeImage(testDirectory.resolve("lesion.nii.gz"), SHAPE, NiftiDataType.UINT8,
                1, 1, 0, 0, 0, 0, 0, 1);

        String cfm = imageMaskOperations.createCostFunctionMask(referenceMask.toString(), lesion.toString(), false, testDirectory, null);

        double[] cfmData = NiftiImageIO.read(Paths.get(cfm)).getData();
        assertTrue(Arrays.stream(cfmData).allMatch(v -> v == 0 || v == 1));
        assertArrayEquals(new double[] {0, 0, 1, 1, 1, 1, 1, 0}, cfmData, 0);
    }

    @Test
    public void lesionIsReorientedBeforeSubtraction() {
        Path reference = TestImages.writeImage(testDirectory.resolve("reference.nii.gz"), new int[] {3, 1, 1}, NiftiDataType.UINT8, 1, 1, 1);
        double[][] flippedX = {
                {-1, 0, 0, 2},
                {0, 1, 0, 0},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        };
        Path lesion = TestImages.writeImage(testDirectory.resolve("lesion.nii.gz"), new int[] {3, 1, 1}, NiftiDataType.UINT8, flippedX, 1, 0, 0);

        String cfm = imageMaskOperations.createCostFunctionMask(reference.toString(), lesion.toString(), true, testDirectory, null);

        assertArrayEquals(new double[] {1, 1, 0}, NiftiImageIO.read(Paths.get(cfm)).getData(), 0);
    }

    @Test
    public void nonBinaryMaskRequiresGlobalMask() {
        Path reference = TestImages.writeImage(testDirectory.resolve("reference.nii.gz"), SHAPE, NiftiDataType.FLOAT32,
                0, 0.5, 1, 1, 1, 1, 1, 1);

        expectedException.expect(ConfigurationException.class);
        imageMaskOperations.createCostFunctionMask(reference.toString(), null, false, testDirectory, null);
    }

    @Test
    public void neitherLesionNorGlobalMaskCopiesTheMask() {
        Path referenceMask = TestImages.writeImage(testDirectory.resolve("brainmask.nii.gz"), SHAPE, NiftiDataType.INT16,
                0, 1, 1, 1, 1, 1, 1, 0);

        String cfm = imageMaskOperations.createCostFunctionMask(referenceMask.toString(), null, false, testDirectory, null);

        assertTrue(Files.exists(Paths.get(cfm)));
        assertArrayEquals(new double[] {0, 1, 1, 1, 1, 1, 1, 0}, NiftiImageIO.read(Paths.get(cfm)).getData(), 0);
        verify(logger).warn(anyString());
    }

    @Test
    public void costFunctionMaskNameCarriesThePrefix() {
        Path reference = TestImages.writeImage(testDirectory.resolve("brainmask.nii.gz"), SHAPE, NiftiDataType.UINT8, TestImages.filled(8, 1));

        String cfm = imageMaskOperations.createCostFunctionMask(reference.toString(), null, true, testDirectory, "fixed_");

        assertThat(cfm, equalTo(testDirectory.resolve("fixed_brainmask_cfm.nii.gz").toAbsolutePath().toString()));
    }

    @Test
    public void lesionOnAnotherGridIsAConfigurationError() {
        Path reference = TestImages.writeImage(testDirectory.resolve("reference.nii.gz"), new int[] {3, 3, 3}, NiftiDataType.UINT8, TestImages.filled(27, 1));
        Path lesion = TestImages.writeImage(testDirectory.resolve("lesion.nii.gz"), SHAPE, NiftiDataType.UINT8, TestImages.filled(8, 1));

        assertFalse(imageMaskOperations.isOnSameGrid(reference.toString(), lesion.toString()));
        expectedException.expect(ConfigurationException.class);
        imageMaskOperations.createCostFunctionMask(reference.toString(), lesion.toString(), true, testDirectory, null);
    }
}
