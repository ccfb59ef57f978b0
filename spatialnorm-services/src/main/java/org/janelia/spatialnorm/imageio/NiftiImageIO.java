package org.janelia.spatialnorm.imageio;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads and writes single file NIfTI-1 images (.nii or .nii.gz).
 */
public class NiftiImageIO {

    public static NiftiImage read(Path imagePath) {
        byte[] content;
        try (InputStream imageStream = openInput(imagePath)) {
            content = IOUtils.toByteArray(imageStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + imagePath, e);
        }
        if (content.length < NiftiHeader.HEADER_SIZE) {
            throw new IllegalArgumentException(imagePath + " is not a NIfTI-1 image");
        }
        ByteOrder byteOrder = detectByteOrder(content, imagePath);
        int voxOffset = (int) ByteBuffer.wrap(content, 108, 4).order(byteOrder).getFloat();
        int headerLength = Math.max(voxOffset, NiftiHeader.HEADER_SIZE);
        NiftiHeader header = new NiftiHeader(Arrays.copyOf(content, headerLength), byteOrder);

        NiftiDataType dataType = header.getDataType();
        long nVoxels = NiftiImage.numberOfVoxels(header.getShape());
        long expectedLength = headerLength + nVoxels * dataType.getBytesPerVoxel();
        if (content.length < expectedLength) {
            throw new IllegalArgumentException(String.format("%s is truncated: expected %d bytes but found %d",
                    imagePath, expectedLength, content.length));
        }
        ByteBuffer dataBuffer = ByteBuffer.wrap(content, headerLength, content.length - headerLength).order(byteOrder);
        double[] data = new double[(int) nVoxels];
        boolean scaled = header.hasScaling();
        double slope = header.getSclSlope();
        double inter = header.getSclInter();
        for (int i = 0; i < data.length; i++) {
            double v = readValue(dataBuffer, dataType);
            data[i] = scaled ? v * slope + inter : v;
        }
        return new NiftiImage(header, data);
    }

    /**
     * Write the image using the data type and the scaling of its header.
     */
    public static void write(NiftiImage image, Path imagePath) {
        NiftiHeader header = image.getHeader().copy();
        byte[] headerBytes = header.getHeaderBytes();
        if (headerBytes.length < NiftiHeader.MIN_DATA_OFFSET) {
            headerBytes = Arrays.copyOf(headerBytes, NiftiHeader.MIN_DATA_OFFSET);
            header = new NiftiHeader(headerBytes, header.getByteOrder());
        }
        header.setVoxOffset(headerBytes.length);
        NiftiDataType dataType = header.getDataType();
        boolean scaled = header.hasScaling();
        double slope = header.getSclSlope();
        double inter = header.getSclInter();

        double[] data = image.getData();
        ByteBuffer dataBuffer = ByteBuffer.allocate(data.length * dataType.getBytesPerVoxel()).order(header.getByteOrder());
        for (double v : data) {
            double stored = scaled ? (v - inter) / slope : v;
            writeValue(dataBuffer, dataType, dataType.toStorableValue(stored));
        }
        try {
            if (imagePath.getParent() != null) {
                Files.createDirectories(imagePath.getParent());
            }
            try (OutputStream imageStream = openOutput(imagePath)) {
                imageStream.write(header.getHeaderBytes());
                imageStream.write(dataBuffer.array());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + imagePath, e);
        }
    }

    private static boolean isCompressed(Path imagePath) {
        return StringUtils.endsWithIgnoreCase(imagePath.getFileName().toString(), ".gz");
    }

    private static InputStream openInput(Path imagePath) throws IOException {
        InputStream fileStream = Files.newInputStream(imagePath);
        return isCompressed(imagePath) ? new GzipCompressorInputStream(fileStream) : fileStream;
    }

    private static OutputStream openOutput(Path imagePath) throws IOException {
        OutputStream fileStream = new BufferedOutputStream(Files.newOutputStream(imagePath));
        return isCompressed(imagePath) ? new GzipCompressorOutputStream(fileStream) : fileStream;
    }

    private static ByteOrder detectByteOrder(byte[] content, Path imagePath) {
        if (ByteBuffer.wrap(content, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() == NiftiHeader.HEADER_SIZE) {
            return ByteOrder.LITTLE_ENDIAN;
        } else if (ByteBuffer.wrap(content, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt() == NiftiHeader.HEADER_SIZE) {
            return ByteOrder.BIG_ENDIAN;
        } else {
            throw new IllegalArgumentException(imagePath + " does not have a valid NIfTI-1 header");
        }
    }

    private static double readValue(ByteBuffer buffer, NiftiDataType dataType) {
        switch (dataType) {
            case UINT8:
                return buffer.get() & 0xFF;
            case INT8:
                return buffer.get();
            case INT16:
                return buffer.getShort();
            case UINT16:
                return buffer.getShort() & 0xFFFF;
            case INT32:
                return buffer.getInt();
            case UINT32:
                return buffer.getInt() & 0xFFFFFFFFL;
            case INT64:
                return buffer.getLong();
            case FLOAT32:
                return buffer.getFloat();
            case FLOAT64:
                return buffer.getDouble();
            default:
                throw new IllegalArgumentException("Unsupported data type " + dataType);
        }
    }

    private static void writeValue(ByteBuffer buffer, NiftiDataType dataType, double v) {
        switch (dataType) {
            case UINT8:
            case INT8:
                buffer.put((byte) (long) v);
                break;
            case INT16:
            case UINT16:
                buffer.putShort((short) (long) v);
                break;
            case INT32:
            case UINT32:
                buffer.putInt((int) (long) v);
                break;
            case INT64:
                buffer.putLong((long) v);
                break;
            case FLOAT32:
                buffer.putFloat((float) v);
                break;
            case FLOAT64:
                buffer.putDouble(v);
                break;
            default:
                throw new IllegalArgumentException("Unsupported data type " + dataType);
        }
    }
}
