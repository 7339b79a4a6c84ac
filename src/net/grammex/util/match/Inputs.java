package net.grammex.util.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.grammex.api.match.Input;

public final class Inputs {

    public static class CharInput implements Input<Character> {

        private final CharSequence text;

        public CharInput(CharSequence text) {
            if (text == null)
                throw new NullPointerException(
                    "CharInput text may not be null");
            this.text = text;
        }

        public String toString() {
            return "CharInput[" + text.length() + " chars]";
        }

        public CharSequence getText() {
            return text;
        }

        public int length() {
            return text.length();
        }

        public Character get(int index) {
            return text.charAt(index);
        }

        public char charAt(int index) {
            return text.charAt(index);
        }

        public CharSequence subSequence(int start, int end) {
            return text.subSequence(start, end);
        }

    }

    public static class ByteInput implements Input<Byte> {

        private final byte[] data;
        private final int offset;
        private final int length;

        public ByteInput(byte[] data, int offset, int length) {
            if (data == null)
                throw new NullPointerException(
                    "ByteInput data may not be null");
            if (offset < 0 || length < 0 || offset > data.length ||
                    length > data.length - offset)
                throw new IndexOutOfBoundsException("Invalid ByteInput " +
                    "range " + offset + "+" + length + " of " +
                    data.length + " bytes");
            this.data = data;
            this.offset = offset;
            this.length = length;
        }
        public ByteInput(byte[] data) {
            this(data, 0, data.length);
        }

        public String toString() {
            return "ByteInput[" + length + " bytes]";
        }

        public int length() {
            return length;
        }

        public Byte get(int index) {
            return data[offset + index];
        }

        public byte getByte(int index) {
            return data[offset + index];
        }

        public byte[] copyRange(int start, int end) {
            return Arrays.copyOfRange(data, offset + start, offset + end);
        }

    }

    public static class ListInput<E> implements Input<E> {

        private final List<E> elements;

        public ListInput(List<E> elements) {
            if (elements == null)
                throw new NullPointerException(
                    "ListInput elements may not be null");
            List<E> copy = new ArrayList<E>(elements);
            for (int i = 0; i < copy.size(); i++) {
                if (copy.get(i) == null)
                    throw new NullPointerException("ListInput element " + i +
                        " is null");
            }
            this.elements = Collections.unmodifiableList(copy);
        }

        public String toString() {
            return "ListInput" + elements;
        }

        public List<E> getElements() {
            return elements;
        }

        public int length() {
            return elements.size();
        }

        public E get(int index) {
            return elements.get(index);
        }

    }

    // Prevent construction.
    private Inputs() {}

    public static CharInput of(CharSequence text) {
        return new CharInput(text);
    }

    public static ByteInput of(byte[] data) {
        return new ByteInput(data);
    }
    public static ByteInput of(byte[] data, int offset, int length) {
        return new ByteInput(data, offset, length);
    }

    public static <E> ListInput<E> of(List<E> elements) {
        return new ListInput<E>(elements);
    }

    @SafeVarargs
    public static <E> ListInput<E> ofElements(E... elements) {
        return new ListInput<E>(Arrays.asList(elements));
    }

    /* The characters between start and end. Character inputs are sliced
     * without copying; other inputs are gathered element-wise. */
    public static CharSequence text(Input<Character> input, int start,
                                    int end) {
        if (input instanceof CharInput)
            return ((CharInput) input).subSequence(start, end);
        StringBuilder sb = new StringBuilder(end - start);
        for (int i = start; i < end; i++) sb.append(input.get(i));
        return sb;
    }

    /* The raw bytes between start and end. */
    public static byte[] bytes(Input<Byte> input, int start, int end) {
        if (input instanceof ByteInput)
            return ((ByteInput) input).copyRange(start, end);
        byte[] ret = new byte[end - start];
        for (int i = start; i < end; i++) ret[i - start] = input.get(i);
        return ret;
    }

}
