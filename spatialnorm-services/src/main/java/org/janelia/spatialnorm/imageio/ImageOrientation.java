package org.janelia.spatialnorm.imageio;

import java.util.Arrays;

/**
 * Voxel axis orientation relative to the RAS+ world frame.
 */
public class ImageOrientation {

    /**
     * World axis (0=x, 1=y, 2=z) each voxel axis is closest to.
     */
    private final int[] worldAxes;
    /**
     * +1 if the voxel axis increases along the world axis, -1 otherwise.
     */
    private final int[] directions;

    private ImageOrientation(int[] worldAxes, int[] directions) {
        this.worldAxes = worldAxes;
        this.directions = directions;
    }

    /**
     * Derive the orientation from the rotation/zoom part of an affine by greedily
     * assigning the voxel axis with the strongest world component first.
     */
    public static ImageOrientation fromAffine(double[][] affine) {
        double[][] normalized = new double[3][3];
        for (int col = 0; col < 3; col++) {
            double norm = Math.sqrt(affine[0][col] * affine[0][col] + affine[1][col] * affine[1][col] + affine[2][col] * affine[2][col]);
            for (int row = 0; row < 3; row++) {
                normalized[row][col] = norm == 0 ? 0 : affine[row][col] / norm;
            }
        }
        int[] worldAxes = new int[3];
        int[] directions = new int[3];
        Arrays.fill(worldAxes, -1);
        boolean[] usedRows = new boolean[3];
        for (int n = 0; n < 3; n++) {
            int bestRow = -1;
            int bestCol = -1;
            double bestValue = -1;
            for (int col = 0; col < 3; col++) {
                if (worldAxes[col] != -1) continue;
                for (int row = 0; row < 3; row++) {
                    if (usedRows[row]) continue;
                    if (Math.abs(normalized[row][col]) > bestValue) {
                        bestValue = Math.abs(normalized[row][col]);
                        bestRow = row;
                        bestCol = col;
                    }
                }
            }
            worldAxes[bestCol] = bestRow;
            directions[bestCol] = normalized[bestRow][bestCol] < 0 ? -1 : 1;
            usedRows[bestRow] = true;
        }
        return new ImageOrientation(worldAxes, directions);
    }

    public boolean isCanonical() {
        for (int i = 0; i < 3; i++) {
            if (worldAxes[i] != i || directions[i] != 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return axis codes such as "RAS" or "LPI"
     */
    public String getAxisCodes() {
        String[][] labels = {{"L", "R"}, {"P", "A"}, {"I", "S"}};
        StringBuilder codes = new StringBuilder();
        for (int i = 0; i < 3; i++) {
            codes.append(labels[worldAxes[i]][directions[i] > 0 ? 1 : 0]);
        }
        return codes.toString();
    }

    /**
     * Flip and permute the spatial axes of the image so that it is as close as possible to RAS+.
     * An image that is already canonical is returned as is.
     */
    public static NiftiImage toClosestCanonical(NiftiImage image) {
        int[] shape = image.getShape();
        if (shape.length < 3) {
            return image;
        }
        double[][] affine = image.getAffine();
        ImageOrientation orientation = fromAffine(affine);
        if (orientation.isCanonical()) {
            return image;
        }
        int[] newShape = Arrays.copyOf(shape, shape.length);
        for (int j = 0; j < 3; j++) {
            newShape[orientation.worldAxes[j]] = shape[j];
        }
        int volumeSize = shape[0] * shape[1] * shape[2];
        int nVolumes = image.getData().length / volumeSize;
        double[] data = image.getData();
        double[] newData = new double[data.length];
        int[] oldIndex = new int[3];
        int[] newIndex = new int[3];
        for (int v = 0; v < nVolumes; v++) {
            int volumeOffset = v * volumeSize;
            for (newIndex[2] = 0; newIndex[2] < newShape[2]; newIndex[2]++) {
                for (newIndex[1] = 0; newIndex[1] < newShape[1]; newIndex[1]++) {
                    for (newIndex[0] = 0; newIndex[0] < newShape[0]; newIndex[0]++) {
                        for (int j = 0; j < 3; j++) {
                            int u = newIndex[orientation.worldAxes[j]];
                            oldIndex[j] = orientation.directions[j] > 0 ? u : shape[j] - 1 - u;
                        }
                        int src = oldIndex[0] + shape[0] * (oldIndex[1] + shape[1] * oldIndex[2]);
                        int dst = newIndex[0] + newShape[0] * (newIndex[1] + newShape[1] * newIndex[2]);
                        newData[volumeOffset + dst] = data[volumeOffset + src];
                    }
                }
            }
        }
        // maps new voxel coordinates to old voxel coordinates
        double[][] transform = new double[4][4];
        for (int j = 0; j < 3; j++) {
            transform[j][orientation.worldAxes[j]] = orientation.directions[j];
            transform[j][3] = orientation.directions[j] > 0 ? 0 : shape[j] - 1;
        }
        transform[3][3] = 1;
        double[][] newAffine = multiply(affine, transform);

        NiftiHeader newHeader = image.getHeader().copy();
        newHeader.setShape(newShape);
        int code = newHeader.getSformCode() > 0 ? newHeader.getSformCode() : Math.max(newHeader.getQformCode(), 1);
        newHeader.setAffine(newAffine, code);
        return new NiftiImage(newHeader, newData);
    }

    private static double[][] multiply(double[][] a, double[][] b) {
        double[][] c = new double[4][4];
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                double s = 0;
                for (int k = 0; k < 4; k++) {
                    s += a[i][k] * b[k][j];
                }
                c[i][j] = s;
            }
        }
        return c;
    }
}
