package org.janelia.spatialnorm.imageio;

import java.util.Arrays;

/**
 * NIfTI-1 voxel data types supported by {@link NiftiImageIO}.
 */
public enum NiftiDataType {
    UINT8(2, 8, 0, 255),
    INT16(4, 16, Short.MIN_VALUE, Short.MAX_VALUE),
    INT32(8, 32, Integer.MIN_VALUE, Integer.MAX_VALUE),
    FLOAT32(16, 32, -Float.MAX_VALUE, Float.MAX_VALUE),
    FLOAT64(64, 64, -Double.MAX_VALUE, Double.MAX_VALUE),
    INT8(256, 8, Byte.MIN_VALUE, Byte.MAX_VALUE),
    UINT16(512, 16, 0, 65535),
    UINT32(768, 32, 0, 4294967295.0),
    INT64(1024, 64, Long.MIN_VALUE, Long.MAX_VALUE);

    private final short code;
    private final short bitpix;
    private final double minValue;
    private final double maxValue;

    NiftiDataType(int code, int bitpix, double minValue, double maxValue) {
        this.code = (short) code;
        this.bitpix = (short) bitpix;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public static NiftiDataType fromCode(int code) {
        return Arrays.stream(values())
                .filter(dt -> dt.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported NIfTI datatype code " + code));
    }

    public short getCode() {
        return code;
    }

    public short getBitpix() {
        return bitpix;
    }

    public int getBytesPerVoxel() {
        return bitpix / 8;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    /**
     * Clamp and, for integer types, round a value to what this type can store.
     */
    double toStorableValue(double v) {
        if (isFloatingPoint()) {
            return v;
        }
        double rounded = Math.rint(v);
        return Math.max(minValue, Math.min(maxValue, rounded));
    }
}
