package org.janelia.spatialnorm.imageio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * A NIfTI-1 header backed by the raw bytes read from the file (header plus any extensions),
 * so that fields this package does not interpret survive a read/write cycle unchanged.
 */
public class NiftiHeader {
    static final int HEADER_SIZE = 348;
    static final int MIN_DATA_OFFSET = 352;

    private static final int DIM_OFFSET = 40;
    private static final int DATATYPE_OFFSET = 70;
    private static final int BITPIX_OFFSET = 72;
    private static final int PIXDIM_OFFSET = 76;
    private static final int VOX_OFFSET_OFFSET = 108;
    private static final int SCL_SLOPE_OFFSET = 112;
    private static final int SCL_INTER_OFFSET = 116;
    private static final int QFORM_CODE_OFFSET = 252;
    private static final int SFORM_CODE_OFFSET = 254;
    private static final int QUATERN_B_OFFSET = 256;
    private static final int QOFFSET_X_OFFSET = 268;
    private static final int SROW_X_OFFSET = 280;
    private static final int MAGIC_OFFSET = 344;

    private final byte[] headerBytes;
    private final ByteBuffer buffer;

    /**
     * Create a minimal header for a 3D image with unit voxels and an identity sform.
     */
    public static NiftiHeader create(int[] shape, NiftiDataType dataType) {
        Preconditions.checkArgument(shape.length >= 1 && shape.length <= 7, "Invalid image dimensions: %s", Arrays.toString(shape));
        NiftiHeader header = new NiftiHeader(new byte[MIN_DATA_OFFSET], ByteOrder.LITTLE_ENDIAN);
        header.buffer.putInt(0, HEADER_SIZE);
        header.setShape(shape);
        header.setDataType(dataType);
        float[] pixdim = new float[8];
        Arrays.fill(pixdim, 1f);
        header.setPixdim(pixdim);
        header.setVoxOffset(MIN_DATA_OFFSET);
        header.setScaling(1, 0);
        header.setAffine(new double[][] {
                {1, 0, 0, 0},
                {0, 1, 0, 0},
                {0, 0, 1, 0},
                {0, 0, 0, 1}
        }, 1);
        byte[] magic = "n+1\0".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(magic, 0, header.headerBytes, MAGIC_OFFSET, magic.length);
        return header;
    }

    NiftiHeader(byte[] headerBytes, ByteOrder byteOrder) {
        Preconditions.checkArgument(headerBytes.length >= HEADER_SIZE, "NIfTI header too short: %s bytes", headerBytes.length);
        this.headerBytes = headerBytes;
        this.buffer = ByteBuffer.wrap(headerBytes).order(byteOrder);
    }

    public NiftiHeader copy() {
        return new NiftiHeader(Arrays.copyOf(headerBytes, headerBytes.length), buffer.order());
    }

    byte[] getHeaderBytes() {
        return headerBytes;
    }

    public ByteOrder getByteOrder() {
        return buffer.order();
    }

    public int[] getShape() {
        int ndim = buffer.getShort(DIM_OFFSET);
        Preconditions.checkState(ndim >= 1 && ndim <= 7, "Invalid number of dimensions: %s", ndim);
        int[] shape = new int[ndim];
        for (int i = 0; i < ndim; i++) {
            shape[i] = buffer.getShort(DIM_OFFSET + 2 * (i + 1));
        }
        return shape;
    }

    public void setShape(int[] shape) {
        buffer.putShort(DIM_OFFSET, (short) shape.length);
        for (int i = 0; i < 7; i++) {
            buffer.putShort(DIM_OFFSET + 2 * (i + 1), (short) (i < shape.length ? shape[i] : 1));
        }
    }

    public NiftiDataType getDataType() {
        return NiftiDataType.fromCode(buffer.getShort(DATATYPE_OFFSET));
    }

    public void setDataType(NiftiDataType dataType) {
        buffer.putShort(DATATYPE_OFFSET, dataType.getCode());
        buffer.putShort(BITPIX_OFFSET, dataType.getBitpix());
    }

    public float[] getPixdim() {
        float[] pixdim = new float[8];
        for (int i = 0; i < pixdim.length; i++) {
            pixdim[i] = buffer.getFloat(PIXDIM_OFFSET + 4 * i);
        }
        return pixdim;
    }

    public void setPixdim(float[] pixdim) {
        for (int i = 0; i < 8; i++) {
            buffer.putFloat(PIXDIM_OFFSET + 4 * i, pixdim[i]);
        }
    }

    public int getVoxOffset() {
        return (int) buffer.getFloat(VOX_OFFSET_OFFSET);
    }

    void setVoxOffset(int voxOffset) {
        buffer.putFloat(VOX_OFFSET_OFFSET, voxOffset);
    }

    public float getSclSlope() {
        return buffer.getFloat(SCL_SLOPE_OFFSET);
    }

    public float getSclInter() {
        return buffer.getFloat(SCL_INTER_OFFSET);
    }

    public void setScaling(float slope, float inter) {
        buffer.putFloat(SCL_SLOPE_OFFSET, slope);
        buffer.putFloat(SCL_INTER_OFFSET, inter);
    }

    /**
     * A zero, NaN or infinite slope means the stored values are not scaled.
     */
    boolean hasScaling() {
        float slope = getSclSlope();
        return slope != 0 && Float.isFinite(slope) && !(slope == 1 && getSclInter() == 0);
    }

    public short getQformCode() {
        return buffer.getShort(QFORM_CODE_OFFSET);
    }

    public short getSformCode() {
        return buffer.getShort(SFORM_CODE_OFFSET);
    }

    /**
     * @return the 4x4 voxel to world transform: sform if set, otherwise qform, otherwise voxel sizes.
     */
    public double[][] getAffine() {
        if (getSformCode() > 0) {
            double[][] affine = new double[4][4];
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 4; c++) {
                    affine[r][c] = buffer.getFloat(SROW_X_OFFSET + 16 * r + 4 * c);
                }
            }
            affine[3][3] = 1;
            return affine;
        } else if (getQformCode() > 0) {
            return getQformAffine();
        } else {
            float[] pixdim = getPixdim();
            return new double[][] {
                    {pixdim[1], 0, 0, 0},
                    {0, pixdim[2], 0, 0},
                    {0, 0, pixdim[3], 0},
                    {0, 0, 0, 1}
            };
        }
    }

    private double[][] getQformAffine() {
        double b = buffer.getFloat(QUATERN_B_OFFSET);
        double c = buffer.getFloat(QUATERN_B_OFFSET + 4);
        double d = buffer.getFloat(QUATERN_B_OFFSET + 8);
        double a = Math.sqrt(Math.max(0, 1.0 - (b * b + c * c + d * d)));
        float[] pixdim = getPixdim();
        double qfac = pixdim[0] < 0 ? -1 : 1;
        double[][] r = {
                {a * a + b * b - c * c - d * d, 2 * (b * c - a * d), 2 * (b * d + a * c)},
                {2 * (b * c + a * d), a * a + c * c - b * b - d * d, 2 * (c * d - a * b)},
                {2 * (b * d - a * c), 2 * (c * d + a * b), a * a + d * d - c * c - b * b}
        };
        double[] zooms = {pixdim[1], pixdim[2], qfac * pixdim[3]};
        double[][] affine = new double[4][4];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                affine[row][col] = r[row][col] * zooms[col];
            }
            affine[row][3] = buffer.getFloat(QOFFSET_X_OFFSET + 4 * row);
        }
        affine[3][3] = 1;
        return affine;
    }

    /**
     * Set both the sform and the qform from the given affine.
     */
    public void setAffine(double[][] affine, int code) {
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 4; c++) {
                buffer.putFloat(SROW_X_OFFSET + 16 * r + 4 * c, (float) affine[r][c]);
            }
        }
        buffer.putShort(SFORM_CODE_OFFSET, (short) code);
        setQform(affine, code);
    }

    private void setQform(double[][] affine, int code) {
        double[] zooms = new double[3];
        double[][] r = new double[3][3];
        for (int col = 0; col < 3; col++) {
            zooms[col] = Math.sqrt(affine[0][col] * affine[0][col] + affine[1][col] * affine[1][col] + affine[2][col] * affine[2][col]);
            for (int row = 0; row < 3; row++) {
                r[row][col] = zooms[col] == 0 ? (row == col ? 1 : 0) : affine[row][col] / zooms[col];
            }
        }
        double det = r[0][0] * (r[1][1] * r[2][2] - r[1][2] * r[2][1])
                - r[0][1] * (r[1][0] * r[2][2] - r[1][2] * r[2][0])
                + r[0][2] * (r[1][0] * r[2][1] - r[1][1] * r[2][0]);
        float qfac = 1;
        if (det < 0) {
            qfac = -1;
            for (int row = 0; row < 3; row++) {
                r[row][2] = -r[row][2];
            }
        }
        double a = 1 + r[0][0] + r[1][1] + r[2][2];
        double b;
        double c;
        double d;
        if (a > 0.5) {
            a = 0.5 * Math.sqrt(a);
            b = 0.25 * (r[2][1] - r[1][2]) / a;
            c = 0.25 * (r[0][2] - r[2][0]) / a;
            d = 0.25 * (r[1][0] - r[0][1]) / a;
        } else {
            double xd = 1 + r[0][0] - (r[1][1] + r[2][2]);
            double yd = 1 + r[1][1] - (r[0][0] + r[2][2]);
            double zd = 1 + r[2][2] - (r[0][0] + r[1][1]);
            if (xd > 1) {
                b = 0.5 * Math.sqrt(xd);
                c = 0.25 * (r[0][1] + r[1][0]) / b;
                d = 0.25 * (r[0][2] + r[2][0]) / b;
                a = 0.25 * (r[2][1] - r[1][2]) / b;
            } else if (yd > 1) {
                c = 0.5 * Math.sqrt(yd);
                b = 0.25 * (r[0][1] + r[1][0]) / c;
                d = 0.25 * (r[1][2] + r[2][1]) / c;
                a = 0.25 * (r[0][2] - r[2][0]) / c;
            } else {
                d = 0.5 * Math.sqrt(zd);
                b = 0.25 * (r[0][2] + r[2][0]) / d;
                c = 0.25 * (r[1][2] + r[2][1]) / d;
                a = 0.25 * (r[1][0] - r[0][1]) / d;
            }
            if (a < 0) {
                b = -b;
                c = -c;
                d = -d;
            }
        }
        buffer.putFloat(QUATERN_B_OFFSET, (float) b);
        buffer.putFloat(QUATERN_B_OFFSET + 4, (float) c);
        buffer.putFloat(QUATERN_B_OFFSET + 8, (float) d);
        for (int row = 0; row < 3; row++) {
            buffer.putFloat(QOFFSET_X_OFFSET + 4 * row, (float) affine[row][3]);
        }
        float[] pixdim = getPixdim();
        pixdim[0] = qfac;
        for (int i = 0; i < 3; i++) {
            pixdim[i + 1] = (float) zooms[i];
        }
        setPixdim(pixdim);
        buffer.putShort(QFORM_CODE_OFFSET, (short) code);
    }
}
