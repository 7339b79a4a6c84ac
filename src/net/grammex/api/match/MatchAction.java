package net.grammex.api.match;

/**
 * A semantic action invoked when a rule has matched.
 * The Captures class contains actions that store the matched span into
 * various destinations.
 */
public interface MatchAction<E> {

    /**
     * Process the span of input between start (inclusive) and end
     * (exclusive) that has just been matched.
     */
    void apply(Input<E> input, int start, int end);

}
