package org.janelia.spatialnorm.imageio;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.spatialnorm.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class NiftiImageIOTest {

    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("testNifti");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    @Test
    public void compressedImageKeepsHeaderAndData() {
        double[][] affine = {
                {-2, 0, 0, 90},
                {0, 2, 0, -126},
                {0, 0, 2, -72},
                {0, 0, 0, 1}
        };
        double[] data = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11};
        Path imagePath = TestImages.writeImage(testDirectory.resolve("img.nii.gz"), new int[] {2, 3, 2}, NiftiDataType.INT16, affine, data);

        NiftiImage image = NiftiImageIO.read(imagePath);

        assertThat(image.getHeader().getDataType(), equalTo(NiftiDataType.INT16));
        assertArrayEquals(new int[] {2, 3, 2}, image.getShape());
        assertArrayEquals(data, image.getData(), 0);
        double[][] readAffine = image.getAffine();
        for (int i = 0; i < 4; i++) {
            assertArrayEquals(affine[i], readAffine[i], 1e-5);
        }
        assertThat(image.getHeader().getSformCode(), equalTo((short) 1));
        assertThat(image.getHeader().getQformCode(), equalTo((short) 1));
    }

    @Test
    public void scalingIsAppliedOnRead() {
        NiftiHeader header = NiftiHeader.create(new int[] {2, 2, 1}, NiftiDataType.UINT8);
        header.setScaling(0.5f, 10f);
        Path imagePath = testDirectory.resolve("scaled.nii");
        NiftiImageIO.write(new NiftiImage(header, new double[] {10, 10.5, 11, 20}), imagePath);

        NiftiImage image = NiftiImageIO.read(imagePath);

        assertArrayEquals(new double[] {10, 10.5, 11, 20}, image.getData(), 1e-6);
        assertThat((double) image.getHeader().getSclSlope(), closeTo(0.5, 1e-6));
    }

    @Test
    public void integerTypesAreClampedOnWrite() {
        Path imagePath = TestImages.writeImage(testDirectory.resolve("clamped.nii"), new int[] {4, 1, 1}, NiftiDataType.UINT8,
                -3, 0.6, 255, 300);

        NiftiImage image = NiftiImageIO.read(imagePath);

        assertArrayEquals(new double[] {0, 1, 255, 255}, image.getData(), 0);
        assertThat(image.getHeader().getByteOrder(), equalTo(ByteOrder.LITTLE_ENDIAN));
    }

    @Test
    public void fourDimensionalImage() {
        double[] data = TestImages.filled(2 * 2 * 2 * 3, 1.5);
        Path imagePath = TestImages.writeImage(testDirectory.resolve("timeseries.nii.gz"), new int[] {2, 2, 2, 3}, NiftiDataType.FLOAT32, data);

        NiftiImage image = NiftiImageIO.read(imagePath);

        assertThat(image.getData().length, equalTo(24));
        assertThat(image.getHeader().getDataType(), equalTo(NiftiDataType.FLOAT32));
        assertThat(new Integer[] {image.getShape()[0], image.getShape()[3]}, arrayContaining(2, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void notANiftiFile() throws IOException {
        Path notAnImage = testDirectory.resolve("text.nii");
        Files.write(notAnImage, new byte[400]);
        NiftiImageIO.read(notAnImage);
    }
}
