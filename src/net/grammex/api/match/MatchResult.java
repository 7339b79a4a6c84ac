package net.grammex.api.match;

/**
 * The outcome of matching a Rule.
 * A MatchResult consists of a flag indicating whether the rule matched, the
 * position immediately after the last element consumed, and the position
 * the consumed span started at.
 * A failed MatchResult reports its start as its position, so that a failure
 * never consumes any input.
 */
public final class MatchResult {

    private final boolean matched;
    private final int position;
    private final int start;

    private MatchResult(boolean matched, int position, int start) {
        this.matched = matched;
        this.position = position;
        this.start = start;
    }

    public String toString() {
        if (! matched) return "MatchResult[failed at " + start + "]";
        return "MatchResult[matched " + start + ".." + position + "]";
    }

    public boolean equals(Object other) {
        if (! (other instanceof MatchResult)) return false;
        MatchResult mo = (MatchResult) other;
        return (matched == mo.matched && position == mo.position &&
                start == mo.start);
    }

    public int hashCode() {
        return (matched ? 1 : 0) ^ position * 31 ^ start * 961;
    }

    /**
     * Whether the rule matched.
     */
    public boolean isMatched() {
        return matched;
    }

    /**
     * The position after the consumed span if the rule matched, or the
     * start position if it did not.
     */
    public int getPosition() {
        return position;
    }

    /**
     * The position the consumed span starts at.
     */
    public int getStart() {
        return start;
    }

    /**
     * The amount of elements consumed (zero for failed results).
     */
    public int length() {
        return position - start;
    }

    /**
     * Create a result whose consumed span is empty.
     */
    public static MatchResult of(boolean matched, int position) {
        return new MatchResult(matched, position, position);
    }

    /**
     * Create a result spanning from start to position.
     * If matched is false, the position is rewound to start.
     */
    public static MatchResult of(boolean matched, int position, int start) {
        return new MatchResult(matched, (matched ? position : start), start);
    }

    /**
     * Shorthand for of(true, position, start).
     */
    public static MatchResult success(int position, int start) {
        return new MatchResult(true, position, start);
    }

    /**
     * Shorthand for of(false, start).
     */
    public static MatchResult failure(int start) {
        return new MatchResult(false, start, start);
    }

}
