package net.grammex.util.match;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import net.grammex.api.match.BinaryLayout;

public final class Layouts {

    /* Shared plumbing: subclasses read and write a single value through a
     * ByteBuffer of the right width and byte order. */
    public static abstract class BufferLayout<T> implements BinaryLayout<T> {

        private final String name;
        private final int width;
        private final ByteOrder order;

        public BufferLayout(String name, int width, ByteOrder order) {
            if (width <= 0)
                throw new IllegalArgumentException("Layout width must be " +
                    "positive");
            this.name = name;
            this.width = width;
            this.order = order;
        }

        public String toString() {
            return name;
        }

        public int getWidth() {
            return width;
        }

        public ByteOrder getOrder() {
            return order;
        }

        public T decode(byte[] data) {
            if (data.length != width)
                throw new IllegalArgumentException("Layout " + name +
                    " needs " + width + " bytes, got " + data.length);
            return read(ByteBuffer.wrap(data).order(order));
        }

        public byte[] encode(T value) {
            if (value == null)
                throw new NullPointerException(
                    "Encoded value may not be null");
            ByteBuffer buf = ByteBuffer.allocate(width).order(order);
            write(buf, value);
            return buf.array();
        }

        protected abstract T read(ByteBuffer buf);

        protected abstract void write(ByteBuffer buf, T value);

    }

    public static final BinaryLayout<Byte> INT8 =
        new BufferLayout<Byte>("int8", 1, ByteOrder.BIG_ENDIAN) {
            protected Byte read(ByteBuffer buf) {
                return buf.get();
            }
            protected void write(ByteBuffer buf, Byte value) {
                buf.put(value);
            }
        };

    public static final BinaryLayout<Integer> UINT8 =
        new BufferLayout<Integer>("uint8", 1, ByteOrder.BIG_ENDIAN) {
            protected Integer read(ByteBuffer buf) {
                return buf.get() & 0xFF;
            }
            protected void write(ByteBuffer buf, Integer value) {
                buf.put((byte) (int) value);
            }
        };

    public static final BinaryLayout<Short> INT16_LE =
        int16(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Short> INT16_BE =
        int16(ByteOrder.BIG_ENDIAN);
    public static final BinaryLayout<Integer> UINT16_LE =
        uint16(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Integer> UINT16_BE =
        uint16(ByteOrder.BIG_ENDIAN);
    public static final BinaryLayout<Integer> INT32_LE =
        int32(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Integer> INT32_BE =
        int32(ByteOrder.BIG_ENDIAN);
    public static final BinaryLayout<Long> INT64_LE =
        int64(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Long> INT64_BE =
        int64(ByteOrder.BIG_ENDIAN);
    public static final BinaryLayout<Float> FLOAT32_LE =
        float32(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Float> FLOAT32_BE =
        float32(ByteOrder.BIG_ENDIAN);
    public static final BinaryLayout<Double> FLOAT64_LE =
        float64(ByteOrder.LITTLE_ENDIAN);
    public static final BinaryLayout<Double> FLOAT64_BE =
        float64(ByteOrder.BIG_ENDIAN);

    // Prevent construction.
    private Layouts() {}

    private static String suffix(ByteOrder order) {
        return (order == ByteOrder.LITTLE_ENDIAN) ? "le" : "be";
    }

    public static BinaryLayout<Short> int16(ByteOrder order) {
        return new BufferLayout<Short>("int16" + suffix(order), 2, order) {
            protected Short read(ByteBuffer buf) {
                return buf.getShort();
            }
            protected void write(ByteBuffer buf, Short value) {
                buf.putShort(value);
            }
        };
    }

    public static BinaryLayout<Integer> uint16(ByteOrder order) {
        return new BufferLayout<Integer>("uint16" + suffix(order), 2,
                                         order) {
            protected Integer read(ByteBuffer buf) {
                return buf.getShort() & 0xFFFF;
            }
            protected void write(ByteBuffer buf, Integer value) {
                buf.putShort((short) (int) value);
            }
        };
    }

    public static BinaryLayout<Integer> int32(ByteOrder order) {
        return new BufferLayout<Integer>("int32" + suffix(order), 4,
                                         order) {
            protected Integer read(ByteBuffer buf) {
                return buf.getInt();
            }
            protected void write(ByteBuffer buf, Integer value) {
                buf.putInt(value);
            }
        };
    }

    public static BinaryLayout<Long> int64(ByteOrder order) {
        return new BufferLayout<Long>("int64" + suffix(order), 8, order) {
            protected Long read(ByteBuffer buf) {
                return buf.getLong();
            }
            protected void write(ByteBuffer buf, Long value) {
                buf.putLong(value);
            }
        };
    }

    public static BinaryLayout<Float> float32(ByteOrder order) {
        return new BufferLayout<Float>("float32" + suffix(order), 4,
                                       order) {
            protected Float read(ByteBuffer buf) {
                return buf.getFloat();
            }
            protected void write(ByteBuffer buf, Float value) {
                buf.putFloat(value);
            }
        };
    }

    public static BinaryLayout<Double> float64(ByteOrder order) {
        return new BufferLayout<Double>("float64" + suffix(order), 8,
                                        order) {
            protected Double read(ByteBuffer buf) {
                return buf.getDouble();
            }
            protected void write(ByteBuffer buf, Double value) {
                buf.putDouble(value);
            }
        };
    }

}
