package net.grammex.util.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammex.api.match.FailureHandler;
import net.grammex.api.match.Input;
import net.grammex.util.Formats;

/**
 * A collector of failure reports.
 * expecting() creates FailureHandler-s that record a Diagnostic whenever
 * the rule they guard fails; RuleMatcher reports the furthest one when it
 * rejects an input.
 */
public class Diagnostics<E> {

    public static class Diagnostic {

        private final String message;
        private final int index;

        public Diagnostic(String message, int index) {
            if (message == null)
                throw new NullPointerException(
                    "Diagnostic message may not be null");
            this.message = message;
            this.index = index;
        }

        public String toString() {
            return message + " (at " + index + ")";
        }

        public boolean equals(Object other) {
            if (! (other instanceof Diagnostic)) return false;
            Diagnostic d = (Diagnostic) other;
            return (message.equals(d.message) && index == d.index);
        }

        public int hashCode() {
            return message.hashCode() ^ index;
        }

        public String getMessage() {
            return message;
        }

        public int getIndex() {
            return index;
        }

    }

    private final List<Diagnostic> entries;
    private final List<Diagnostic> entriesView;

    {
        entries = new ArrayList<Diagnostic>();
        entriesView = Collections.unmodifiableList(entries);
    }

    public String toString() {
        return "Diagnostics" + entries;
    }

    public List<Diagnostic> getEntries() {
        return entriesView;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void add(Diagnostic d) {
        entries.add(d);
    }

    public void clear() {
        entries.clear();
    }

    /* The entry with the greatest index; among equals, the first one
     * recorded. */
    public Diagnostic getFurthest() {
        Diagnostic ret = null;
        for (Diagnostic d : entries) {
            if (ret == null || d.getIndex() > ret.getIndex()) ret = d;
        }
        return ret;
    }

    public FailureHandler<E> expecting(final String message) {
        if (message == null)
            throw new NullPointerException(
                "Diagnostic message may not be null");
        return new FailureHandler<E>() {
            public void onFailure(Input<E> input, int begin, int end) {
                add(new Diagnostic(message, begin));
            }
            public String toString() {
                return "expecting " + Formats.formatString(message);
            }
        };
    }

}
