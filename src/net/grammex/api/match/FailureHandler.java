package net.grammex.api.match;

/**
 * A callback invoked when a guarded rule fails.
 * Failure handlers are the means of turning a failed match into a
 * diagnostic (or a recovery action) at the point where all alternatives
 * of an ordered choice have been exhausted.
 */
public interface FailureHandler<E> {

    /**
     * Handle the failure of a rule matched at begin.
     * end is the end of the range the rule was matched against.
     */
    void onFailure(Input<E> input, int begin, int end);

}
