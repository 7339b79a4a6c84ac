package net.grammex.api.match;

/**
 * The binary representation of a fixed-size value.
 * Binary terminals use a layout to find out how many bytes a value
 * occupies and how to convert between the value and those bytes.
 */
public interface BinaryLayout<T> {

    /**
     * The amount of bytes a value occupies; always positive.
     */
    int getWidth();

    /**
     * Convert exactly getWidth() bytes into a value.
     */
    T decode(byte[] data);

    /**
     * Convert a value into exactly getWidth() bytes.
     */
    byte[] encode(T value);

}
