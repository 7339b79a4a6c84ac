package net.grammex.util.match;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammex.api.match.FailureHandler;
import net.grammex.api.match.Input;
import net.grammex.api.match.TextLocation;

public class LoggingFailureHandler<E> implements FailureHandler<E> {

    private static final Logger LOGGER = Logger.getLogger("FailureHandler");

    private final String message;
    private final Level level;
    private final MatchSettings settings;

    public LoggingFailureHandler(String message, Level level,
                                 MatchSettings settings) {
        if (message == null)
            throw new NullPointerException(
                "Failure message may not be null");
        if (level == null)
            throw new NullPointerException("Log level may not be null");
        if (settings == null)
            throw new NullPointerException("Settings may not be null");
        this.message = message;
        this.level = level;
        this.settings = settings;
    }
    public LoggingFailureHandler(String message) {
        this(message, Level.WARNING, MatchSettings.load());
    }

    public String toString() {
        return "log(" + message + ")";
    }

    public String getMessage() {
        return message;
    }

    public Level getLevel() {
        return level;
    }

    public void onFailure(Input<E> input, int begin, int end) {
        if (! LOGGER.isLoggable(level)) return;
        TextLocation loc = RuleMatcher.locate(input, begin,
                                              settings.getTabSize());
        LOGGER.log(level, message + " at " + loc + ": " +
                   RuleMatcher.describeContext(input, begin, end,
                                               settings.getContextLength()));
    }

}
