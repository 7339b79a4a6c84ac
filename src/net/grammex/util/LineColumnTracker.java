package net.grammex.util;

import net.grammex.api.match.TextLocation;

/* FIXME: Add support for non-BMP characters and for fullwidth ones. */
public class LineColumnTracker implements TextLocation {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d (char %d)", getLine(),
                                 getColumn(), getCharacterIndex());
        }

        public boolean equals(Object other) {
            if (! (other instanceof TextLocation)) return false;
            TextLocation co = (TextLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    public static final int DEFAULT_TAB_SIZE = 8;

    private long line;
    private long column;
    private long characterIndex;
    private boolean inNL;
    private int tabSize;

    public LineColumnTracker(long line, long column, long characterIndex,
                             boolean inNL, int tabSize) {
        if (tabSize <= 0)
            throw new IllegalArgumentException("Tab size must be positive");
        this.line = line;
        this.column = column;
        this.characterIndex = characterIndex;
        this.inNL = inNL;
        this.tabSize = tabSize;
    }
    public LineColumnTracker(int tabSize) {
        this(1, 1, 0, false, tabSize);
    }
    public LineColumnTracker() {
        this(DEFAULT_TAB_SIZE);
    }

    public String toString() {
        return String.format("%s@%h[line=%s,column=%s,char=%s,inNL=%s," +
            "tabSize=%s]", getClass().getName(), this, getLine(),
            getColumn(), getCharacterIndex(), isInNL(), getTabSize());
    }

    public long getLine() {
        return line;
    }

    public long getColumn() {
        return column;
    }

    public long getCharacterIndex() {
        return characterIndex;
    }

    public boolean isInNL() {
        return inNL;
    }

    public int getTabSize() {
        return tabSize;
    }

    public FixedLocation snapshot() {
        return new FixedLocation(this);
    }

    @SuppressWarnings("fallthrough")
    public void advance(char ch) {
        characterIndex++;
        switch (ch) {
            case '\t':
                column = (column + tabSize - 1) / tabSize * tabSize + 1;
                break;
            case '\n':
                if (inNL) break;
                // Intentionally falling through.
            case '\r':
                line++;
                column = 1;
                break;
            default:
                column++;
                break;
        }
        inNL = (ch == '\r');
    }
    public void advance(CharSequence data, int offset, int size) {
        for (int i = offset, ei = offset + size; i < ei; i++) {
            advance(data.charAt(i));
        }
    }

    /* The location of the index-th character of text. */
    public static FixedLocation locate(CharSequence text, int index,
                                       int tabSize) {
        LineColumnTracker tracker = new LineColumnTracker(tabSize);
        tracker.advance(text, 0, Math.min(index, text.length()));
        return tracker.snapshot();
    }

}
