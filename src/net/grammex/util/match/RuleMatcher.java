package net.grammex.util.match;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammex.api.match.Input;
import net.grammex.api.match.MatchResult;
import net.grammex.api.match.MatchingException;
import net.grammex.api.match.Rule;
import net.grammex.api.match.TextLocation;
import net.grammex.util.Formats;
import net.grammex.util.LineColumnTracker;

/**
 * Applies a rule to whole inputs.
 * match() and matches() mirror Rule.match(); parse() additionally demands
 * that the entire input be consumed and turns a rejection into a
 * MatchingException whose location and message come from the furthest
 * recorded diagnostic (if a Diagnostics instance is attached and any
 * failure hook fired).
 */
public class RuleMatcher<E> {

    private static final Logger LOGGER = Logger.getLogger("RuleMatcher");

    private final Rule<E> rule;
    private final MatchSettings settings;
    private final Diagnostics<E> diagnostics;

    public RuleMatcher(Rule<E> rule, MatchSettings settings,
                       Diagnostics<E> diagnostics) {
        if (rule == null)
            throw new NullPointerException("Rule may not be null");
        if (settings == null)
            throw new NullPointerException("Settings may not be null");
        this.rule = rule;
        this.settings = settings;
        this.diagnostics = diagnostics;
    }
    public RuleMatcher(Rule<E> rule, Diagnostics<E> diagnostics) {
        this(rule, MatchSettings.load(), diagnostics);
    }
    public RuleMatcher(Rule<E> rule) {
        this(rule, MatchSettings.load(), null);
    }

    public String toString() {
        return String.format("%s@%h[rule=%s]", getClass().getName(), this,
                             rule);
    }

    public Rule<E> getRule() {
        return rule;
    }

    public MatchSettings getSettings() {
        return settings;
    }

    public Diagnostics<E> getDiagnostics() {
        return diagnostics;
    }

    public MatchResult match(Input<E> input, int begin, int end) {
        if (begin < 0 || end > input.length() || begin > end)
            throw new IndexOutOfBoundsException("Invalid match range " +
                begin + ".." + end + " of " + input.length() + " elements");
        return rule.match(input, begin, end);
    }
    public MatchResult match(Input<E> input) {
        return match(input, 0, input.length());
    }

    public boolean matches(Input<E> input) {
        MatchResult r = match(input);
        return (r.isMatched() && r.getPosition() == input.length());
    }

    public MatchResult parse(Input<E> input) throws MatchingException {
        if (diagnostics != null) diagnostics.clear();
        MatchResult r = match(input);
        if (r.isMatched() && r.getPosition() == input.length()) return r;
        Diagnostics.Diagnostic diag = (diagnostics == null) ? null :
            diagnostics.getFurthest();
        int index;
        String message;
        if (diag != null && (! r.isMatched() ||
                             diag.getIndex() >= r.getPosition())) {
            index = diag.getIndex();
            message = diag.getMessage();
        } else if (r.isMatched()) {
            index = r.getPosition();
            message = "Unexpected trailing input";
        } else {
            index = r.getPosition();
            message = "Input does not match " + rule;
        }
        TextLocation loc = locate(input, index, settings.getTabSize());
        String full = message + " at " + loc + ": " +
            describeContext(input, index, input.length(),
                            settings.getContextLength());
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine("Rejecting input: " + full);
        throw new MatchingException(loc, full);
    }

    /* The line and column of the index-th element of input. Inputs that
     * are not text are a single line. */
    public static TextLocation locate(Input<?> input, int index,
                                      int tabSize) {
        if (input instanceof Inputs.CharInput)
            return LineColumnTracker.locate(
                ((Inputs.CharInput) input).getText(), index, tabSize);
        return new LineColumnTracker.FixedLocation(1, index + 1, index);
    }

    /* A short quote of the input at index, for error messages. */
    public static String describeContext(Input<?> input, int index,
                                         int end, int maxLength) {
        if (index >= end) return "end of input";
        if (input instanceof Inputs.CharInput) {
            CharSequence rest = ((Inputs.CharInput) input).subSequence(index,
                end);
            return Formats.formatString(Formats.abbreviate(rest, maxLength));
        }
        return "element " + Formats.formatElement(input.get(index));
    }

}
