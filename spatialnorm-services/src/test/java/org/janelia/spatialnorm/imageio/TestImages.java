package org.janelia.spatialnorm.imageio;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Helpers to write small NIfTI fixtures.
 */
public class TestImages {

    public static Path writeImage(Path imagePath, int[] shape, NiftiDataType dataType, double... data) {
        NiftiImageIO.write(new NiftiImage(NiftiHeader.create(shape, dataType), data), imagePath);
        return imagePath;
    }

    public static Path writeImage(Path imagePath, int[] shape, NiftiDataType dataType, double[][] affine, double... data) {
        NiftiHeader header = NiftiHeader.create(shape, dataType);
        header.setAffine(affine, 1);
        NiftiImageIO.write(new NiftiImage(header, data), imagePath);
        return imagePath;
    }

    public static double[] filled(int n, double value) {
        double[] data = new double[n];
        Arrays.fill(data, value);
        return data;
    }
}
