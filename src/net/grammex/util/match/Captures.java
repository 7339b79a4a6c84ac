package net.grammex.util.match;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.grammex.api.match.BinaryLayout;
import net.grammex.api.match.Input;
import net.grammex.api.match.MatchAction;
import net.grammex.api.match.MatchResult;
import net.grammex.api.match.Variable;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Rules and actions that store matched input into caller-owned
 * destinations.
 * Every capturing rule or action is bound to its destination at
 * construction; using the same instance twice writes into the same
 * destination twice.
 * Stores are never rolled back: when an enclosing alternative, selection,
 * or negation discards a branch that has already captured something, the
 * captured value stays in place. Grammars that need clean destinations on
 * failure must capture only after the deciding rule has matched (e.g. by
 * attaching the action to the enclosing sequence).
 */
public final class Captures {

    /* Reads a single fixed-width value. The destination is written only
     * once the full width has been read. */
    public static class VariableRule<T> extends AbstractRule<Byte> {

        private final Variable<T> destination;
        private final BinaryLayout<T> layout;

        public VariableRule(Variable<T> destination, BinaryLayout<T> layout) {
            if (destination == null)
                throw new NullPointerException(
                    "Capture destination may not be null");
            Rules.checkLayout(layout);
            this.destination = destination;
            this.layout = layout;
        }

        protected String toStringBase() {
            return "var(" + layout + ")";
        }

        public MatchResult match(Input<Byte> input, int begin, int end) {
            int next = begin + layout.getWidth();
            if (end - begin < layout.getWidth())
                return MatchResult.failure(begin);
            destination.set(layout.decode(Inputs.bytes(input, begin, next)));
            return MatchResult.success(next, begin);
        }

    }

    /* Reads destination.length values in a row. On a short read, the
     * values read so far stay in the array. */
    public static class ArrayRule<T> extends AbstractRule<Byte> {

        private final T[] destination;
        private final BinaryLayout<T> layout;

        public ArrayRule(T[] destination, BinaryLayout<T> layout) {
            if (destination == null)
                throw new NullPointerException(
                    "Capture destination may not be null");
            Rules.checkLayout(layout);
            this.destination = destination;
            this.layout = layout;
        }

        protected String toStringBase() {
            return "array(" + layout + "[" + destination.length + "])";
        }

        public MatchResult match(Input<Byte> input, int begin, int end) {
            int width = layout.getWidth(), position = begin;
            for (int i = 0; i < destination.length; i++) {
                if (end - position < width) return MatchResult.failure(begin);
                destination[i] = layout.decode(Inputs.bytes(input, position,
                    position + width));
                position += width;
            }
            return MatchResult.success(position, begin);
        }

    }

    /* Reads up to maxOccurrence values into a collection that is cleared
     * at the start of every match. */
    public static class CollectRule<T> extends AbstractRule<Byte> {

        private final Collection<? super T> destination;
        private final BinaryLayout<T> layout;
        private final int minOccurrence;
        private final int maxOccurrence;

        public CollectRule(Collection<? super T> destination,
                           BinaryLayout<T> layout, int minOccurrence,
                           int maxOccurrence) {
            if (destination == null)
                throw new NullPointerException(
                    "Capture destination may not be null");
            Rules.checkLayout(layout);
            Rules.checkBounds(minOccurrence, maxOccurrence);
            this.destination = destination;
            this.layout = layout;
            this.minOccurrence = minOccurrence;
            this.maxOccurrence = maxOccurrence;
        }

        protected String toStringBase() {
            return "collect(" + layout + Rules.formatBounds(minOccurrence,
                maxOccurrence) + ")";
        }

        public MatchResult match(Input<Byte> input, int begin, int end) {
            destination.clear();
            int width = layout.getWidth(), position = begin, count = 0;
            while (count < maxOccurrence && end - position >= width) {
                destination.add(layout.decode(Inputs.bytes(input, position,
                    position + width)));
                position += width;
                count++;
            }
            return MatchResult.of(count >= minOccurrence, position, begin);
        }

    }

    /* Base for actions with a readable description. */
    public static abstract class NamedAction<E> implements MatchAction<E> {

        private final String name;

        public NamedAction(String name) {
            this.name = name;
        }

        public String toString() {
            return name;
        }

    }

    // Prevent construction.
    private Captures() {}

    private static void checkDestination(Object dest) {
        if (dest == null)
            throw new NullPointerException(
                "Capture destination may not be null");
    }

    public static MatchAction<Character> text(
            final Variable<String> destination) {
        checkDestination(destination);
        return new NamedAction<Character>("text") {
            public void apply(Input<Character> input, int start, int end) {
                destination.set(Inputs.text(input, start, end).toString());
            }
        };
    }

    /* Stores the span parsed as a decimal int; spans that do not parse
     * (e.g. because they overflow) clear the destination. */
    public static MatchAction<Character> integer(
            final Variable<Integer> destination) {
        checkDestination(destination);
        return new NamedAction<Character>("integer") {
            public void apply(Input<Character> input, int start, int end) {
                String text = Inputs.text(input, start, end).toString();
                try {
                    destination.set(Integer.valueOf(text));
                } catch (NumberFormatException exc) {
                    destination.clear();
                }
            }
        };
    }

    public static MatchAction<Character> floating(
            final Variable<Double> destination) {
        checkDestination(destination);
        return new NamedAction<Character>("floating") {
            public void apply(Input<Character> input, int start, int end) {
                String text = Inputs.text(input, start, end).toString();
                try {
                    destination.set(Double.valueOf(text));
                } catch (NumberFormatException exc) {
                    destination.clear();
                }
            }
        };
    }

    public static MatchAction<Character> append(
            final List<? super String> destination) {
        checkDestination(destination);
        return new NamedAction<Character>("append") {
            public void apply(Input<Character> input, int start, int end) {
                destination.add(Inputs.text(input, start, end).toString());
            }
        };
    }

    public static <E> MatchAction<E> count(final AtomicInteger counter) {
        checkDestination(counter);
        return new NamedAction<E>("count") {
            public void apply(Input<E> input, int start, int end) {
                counter.incrementAndGet();
            }
        };
    }

    public static <E> MatchAction<E> span(final Variable<int[]> destination) {
        checkDestination(destination);
        return new NamedAction<E>("span") {
            public void apply(Input<E> input, int start, int end) {
                destination.set(new int[] { start, end });
            }
        };
    }

    public static MatchAction<Character> json(final JSONObject destination,
                                              final String key) {
        checkDestination(destination);
        if (key == null)
            throw new NullPointerException("JSON key may not be null");
        return new NamedAction<Character>("json(" + key + ")") {
            public void apply(Input<Character> input, int start, int end) {
                destination.put(key,
                                Inputs.text(input, start, end).toString());
            }
        };
    }

    public static MatchAction<Character> jsonAppend(
            final JSONArray destination) {
        checkDestination(destination);
        return new NamedAction<Character>("jsonAppend") {
            public void apply(Input<Character> input, int start, int end) {
                destination.put(Inputs.text(input, start, end).toString());
            }
        };
    }

}
