package org.janelia.spatialnorm.imageio;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * An image volume with its voxel values (scaling already applied) stored in file order,
 * i.e. the first axis varies fastest.
 */
public class NiftiImage {
    private final NiftiHeader header;
    private final double[] data;

    public NiftiImage(NiftiHeader header, double[] data) {
        Preconditions.checkArgument(data.length == numberOfVoxels(header.getShape()),
                "Data size %s does not match image shape %s", data.length, Arrays.toString(header.getShape()));
        this.header = header;
        this.data = data;
    }

    static long numberOfVoxels(int[] shape) {
        long n = 1;
        for (int d : shape) {
            n *= d;
        }
        return n;
    }

    public NiftiHeader getHeader() {
        return header;
    }

    public int[] getShape() {
        return header.getShape();
    }

    public double[][] getAffine() {
        return header.getAffine();
    }

    public double[] getData() {
        return data;
    }

    public boolean hasSameShape(NiftiImage other) {
        return Arrays.equals(getShape(), other.getShape());
    }

    /**
     * @return a new image on the same grid, with a copy of this header and the given voxel values
     */
    public NiftiImage withData(double[] newData) {
        return new NiftiImage(header.copy(), newData);
    }
}
