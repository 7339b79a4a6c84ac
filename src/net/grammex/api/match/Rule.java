package net.grammex.api.match;

/**
 * A pattern that can be matched against a range of an Input.
 * Rules are immutable (with the exception of capture destinations the
 * embedding code binds into some of them) and may be matched any amount of
 * times against any amount of inputs.
 * Matching never throws exceptions for any input; a failure is reported
 * through the MatchResult, and leaves the position where the match
 * started.
 */
public interface Rule<E> {

    /**
     * Match this rule against the elements of input between begin
     * (inclusive) and end (exclusive).
     * The result is never null. If the rule matches, the position of the
     * result lies between begin and end; if it does not, the position is
     * begin.
     */
    MatchResult match(Input<E> input, int begin, int end);

}
