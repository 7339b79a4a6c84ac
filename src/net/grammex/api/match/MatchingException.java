package net.grammex.api.match;

/**
 * Exception thrown when an input as a whole is rejected by a rule.
 * The position is the furthest location a diagnostic was recorded for, or
 * the location matching stopped at if there were no diagnostics.
 */
public class MatchingException extends LocatedMatchException {

    public MatchingException(TextLocation pos) {
        super(pos);
    }
    public MatchingException(TextLocation pos, String message) {
        super(pos, message);
    }
    public MatchingException(TextLocation pos, Throwable cause) {
        super(pos, cause);
    }
    public MatchingException(TextLocation pos, String message,
                             Throwable cause) {
        super(pos, message, cause);
    }

}
