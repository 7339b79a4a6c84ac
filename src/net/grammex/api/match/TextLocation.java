package net.grammex.api.match;

/**
 * A location inside a (multi-line) text.
 * The location consists of line and column numbers as well as an element
 * index; see the method descriptions for more details.
 * For inputs that are not text, the whole input is treated as a single
 * line.
 */
public interface TextLocation {

    /**
     * The 1-based line index.
     */
    long getLine();

    /**
     * The 1-based column index.
     */
    long getColumn();

    /**
     * The 0-based element index. For text, elements are Java characters,
     * i.e. UTF-16 code units.
     */
    long getCharacterIndex();

}
