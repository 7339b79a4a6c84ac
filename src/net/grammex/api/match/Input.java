package net.grammex.api.match;

/**
 * A read-only sequence of elements rules are matched against.
 * Positions into an Input are plain int indexes between 0 and length()
 * (inclusive); rules only compare, subtract, and advance them.
 * The Inputs class contains adapters for character sequences, byte arrays,
 * and lists.
 */
public interface Input<E> {

    /**
     * The amount of elements in this input.
     */
    int length();

    /**
     * The element at the given 0-based index.
     * The index must be less than length(); callers (i.e. rules) are
     * responsible for checking that. Implementations never return null.
     */
    E get(int index);

}
