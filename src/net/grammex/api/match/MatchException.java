package net.grammex.api.match;

/**
 * Generic superclass for checked exceptions of the matching module.
 * Matching a Rule never throws; these exceptions arise on the embedding
 * side (grammar validation, rejection of a whole input).
 */
public class MatchException extends Exception {

    public MatchException() {
        super();
    }
    public MatchException(String message) {
        super(message);
    }
    public MatchException(Throwable cause) {
        super(cause);
    }
    public MatchException(String message, Throwable cause) {
        super(message, cause);
    }

}
