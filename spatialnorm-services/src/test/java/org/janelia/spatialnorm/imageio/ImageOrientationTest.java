package org.janelia.spatialnorm.imageio;

import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ImageOrientationTest {

    @Test
    public void axisCodes() {
        assertThat(ImageOrientation.fromAffine(affine(new double[][] {
                {-1, 0, 0},
                {0, -1, 0},
                {0, 0, 1}
        })).getAxisCodes(), equalTo("LPS"));
        assertThat(ImageOrientation.fromAffine(affine(new double[][] {
                {0, 0, 2},
                {2, 0, 0},
                {0, -2, 0}
        })).getAxisCodes(), equalTo("AIR"));
    }

    @Test
    public void canonicalImageIsNotChanged() {
        NiftiImage image = new NiftiImage(NiftiHeader.create(new int[] {2, 2, 2}, NiftiDataType.UINT8), TestImages.filled(8, 1));
        assertThat(ImageOrientation.toClosestCanonical(image), sameInstance(image));
    }

    @Test
    public void flippedAxisIsReversed() {
        NiftiHeader header = NiftiHeader.create(new int[] {3, 2, 2}, NiftiDataType.INT16);
        header.setAffine(new double[][] {
                {-1, 0, 0, 3},
                {0, 1, 0, 0},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        }, 1);
        double[] data = new double[12];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }

        NiftiImage canonical = ImageOrientation.toClosestCanonical(new NiftiImage(header, data));

        assertArrayEquals(new int[] {3, 2, 2}, canonical.getShape());
        assertArrayEquals(new double[] {2, 1, 0, 5, 4, 3, 8, 7, 6, 11, 10, 9}, canonical.getData(), 0);
        double[][] canonicalAffine = canonical.getAffine();
        assertArrayEquals(new double[] {1, 0, 0, 1}, canonicalAffine[0], 1e-6);
        assertTrue(ImageOrientation.fromAffine(canonicalAffine).isCanonical());
    }

    @Test
    public void permutedAxesAreSwapped() {
        NiftiHeader header = NiftiHeader.create(new int[] {2, 3, 1}, NiftiDataType.INT16);
        header.setAffine(new double[][] {
                {0, 1, 0, 0},
                {1, 0, 0, 0},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        }, 1);
        // value = i + 10 * j for voxel (i, j)
        double[] data = {0, 1, 10, 11, 20, 21};

        NiftiImage canonical = ImageOrientation.toClosestCanonical(new NiftiImage(header, data));

        assertArrayEquals(new int[] {3, 2, 1}, canonical.getShape());
        // the new voxel (x, y) is the old voxel (y, x)
        assertArrayEquals(new double[] {0, 10, 20, 1, 11, 21}, canonical.getData(), 0);
        assertTrue(ImageOrientation.fromAffine(canonical.getAffine()).isCanonical());
    }

    private double[][] affine(double[][] rotation) {
        double[][] affine = new double[4][4];
        for (int r = 0; r < 3; r++) {
            System.arraycopy(rotation[r], 0, affine[r], 0, 3);
        }
        affine[3][3] = 1;
        return affine;
    }
}
