package net.grammex.api.match;

/**
 * A MatchException that pertains to a particular location in the input.
 */
public class LocatedMatchException extends MatchException {

    private final TextLocation position;

    public LocatedMatchException(TextLocation pos) {
        super();
        position = pos;
    }
    public LocatedMatchException(TextLocation pos, String message) {
        super(message);
        position = pos;
    }
    public LocatedMatchException(TextLocation pos, Throwable cause) {
        super(cause);
        position = pos;
    }
    public LocatedMatchException(TextLocation pos, String message,
                                 Throwable cause) {
        super(message, cause);
        position = pos;
    }

    /**
     * The location this exception refers to.
     */
    public TextLocation getPosition() {
        return position;
    }

}
