package org.janelia.atlasreg.image;

import java.nio.ByteBuffer;
import java.util.List;

import com.google.common.collect.ImmutableList;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.ByteType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.integer.ShortType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedIntType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * NRRD voxel types with their accepted spellings.
 */
enum NrrdDataType {
    INT8(1, "int8", "signed char", "int8_t"),
    UINT8(1, "uint8", "uchar", "unsigned char", "uint8_t"),
    INT16(2, "int16", "short", "short int", "signed short", "signed short int", "int16_t"),
    UINT16(2, "uint16", "ushort", "unsigned short", "unsigned short int", "uint16_t"),
    INT32(4, "int32", "int", "signed int", "int32_t"),
    UINT32(4, "uint32", "uint", "unsigned int", "uint32_t"),
    FLOAT(4, "float"),
    DOUBLE(8, "double");

    private final int bytes;
    private final List<String> names;

    NrrdDataType(int bytes, String... names) {
        this.bytes = bytes;
        this.names = ImmutableList.copyOf(names);
    }

    int getBytes() {
        return bytes;
    }

    String getName() {
        return names.get(0);
    }

    static NrrdDataType fromName(String name) {
        String normalized = name.trim().toLowerCase();
        for (NrrdDataType t : values()) {
            if (t.names.contains(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unsupported NRRD type " + name);
    }

    static NrrdDataType fromType(RealType<?> type) {
        if (type instanceof UnsignedByteType) {
            return UINT8;
        } else if (type instanceof ByteType) {
            return INT8;
        } else if (type instanceof UnsignedShortType) {
            return UINT16;
        } else if (type instanceof ShortType) {
            return INT16;
        } else if (type instanceof UnsignedIntType) {
            return UINT32;
        } else if (type instanceof IntType) {
            return INT32;
        } else if (type instanceof FloatType) {
            return FLOAT;
        } else {
            return DOUBLE;
        }
    }

    VolumeImage<?> allocate(ImageGrid grid) {
        switch (this) {
            case INT8:
                return VolumeImage.create(new ByteType(), grid);
            case UINT8:
                return VolumeImage.create(new UnsignedByteType(), grid);
            case INT16:
                return VolumeImage.create(new ShortType(), grid);
            case UINT16:
                return VolumeImage.create(new UnsignedShortType(), grid);
            case INT32:
                return VolumeImage.create(new IntType(), grid);
            case UINT32:
                return VolumeImage.create(new UnsignedIntType(), grid);
            case FLOAT:
                return VolumeImage.create(new FloatType(), grid);
            default:
                return VolumeImage.create(new DoubleType(), grid);
        }
    }

    double read(ByteBuffer buffer) {
        switch (this) {
            case INT8:
                return buffer.get();
            case UINT8:
                return buffer.get() & 0xff;
            case INT16:
                return buffer.getShort();
            case UINT16:
                return buffer.getShort() & 0xffff;
            case INT32:
                return buffer.getInt();
            case UINT32:
                return buffer.getInt() & 0xffffffffL;
            case FLOAT:
                return buffer.getFloat();
            default:
                return buffer.getDouble();
        }
    }

    void write(ByteBuffer buffer, double value) {
        switch (this) {
            case INT8:
            case UINT8:
                buffer.put((byte) (long) value);
                break;
            case INT16:
            case UINT16:
                buffer.putShort((short) (long) value);
                break;
            case INT32:
            case UINT32:
                buffer.putInt((int) (long) value);
                break;
            case FLOAT:
                buffer.putFloat((float) value);
                break;
            default:
                buffer.putDouble(value);
        }
    }

    static <T extends RealType<T> & NativeType<T>> NrrdDataType of(VolumeImage<T> image) {
        return fromType(image.getType());
    }
}
