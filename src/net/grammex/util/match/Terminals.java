package net.grammex.util.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammex.api.match.Decision;
import net.grammex.api.match.ElementPredicate;
import net.grammex.api.match.Input;
import net.grammex.api.match.MatchResult;
import net.grammex.util.Formats;

/**
 * Rules that match input elements directly.
 * Consuming terminals either match their complete unit or fail at the
 * position they were started at.
 */
public final class Terminals {

    public static class EmptyRule<E> extends AbstractRule<E> {

        protected String toStringBase() {
            return "empty";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            return MatchResult.of(true, begin);
        }

    }

    public static class BoolRule<E> extends AbstractRule<E> {

        private final Decision decision;
        private final boolean value;

        public BoolRule(Decision decision) {
            if (decision == null)
                throw new NullPointerException(
                    "Decision may not be null");
            this.decision = decision;
            this.value = false;
        }
        public BoolRule(boolean value) {
            this.decision = null;
            this.value = value;
        }

        protected String toStringBase() {
            return (decision == null) ? String.valueOf(value) : "bool(" +
                decision + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            boolean ok = (decision == null) ? value : decision.decide();
            return MatchResult.of(ok, begin);
        }

    }

    public static class ElementRule<E> extends AbstractRule<E> {

        private final E element;

        public ElementRule(E element) {
            if (element == null)
                throw new NullPointerException(
                    "Matched element may not be null");
            this.element = element;
        }

        protected String toStringBase() {
            return Formats.formatElement(element);
        }

        public E getElement() {
            return element;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            if (begin == end) return MatchResult.failure(begin);
            return MatchResult.of(element.equals(input.get(begin)),
                                  begin + 1, begin);
        }

    }

    public static class AnyRule<E> extends AbstractRule<E> {

        protected String toStringBase() {
            return "any";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            return MatchResult.of(begin != end, begin + 1, begin);
        }

    }

    public static class BinaryPatternRule extends AbstractRule<Byte> {

        private final byte[] pattern;

        public BinaryPatternRule(byte[] pattern) {
            if (pattern == null)
                throw new NullPointerException(
                    "Binary pattern may not be null");
            if (pattern.length == 0)
                throw new IllegalArgumentException(
                    "Binary pattern may not be empty");
            this.pattern = pattern.clone();
        }

        protected String toStringBase() {
            return Formats.formatBytes(pattern);
        }

        public MatchResult match(Input<Byte> input, int begin, int end) {
            if (end - begin < pattern.length)
                return MatchResult.failure(begin);
            for (int i = 0; i < pattern.length; i++) {
                if (input.get(begin + i) != pattern[i])
                    return MatchResult.failure(begin);
            }
            return MatchResult.success(begin + pattern.length, begin);
        }

    }

    /* A pattern held "by reference" is read at match time, so that changes
     * the embedding code makes to it become visible to the rule. */
    public static class StringRule extends AbstractRule<Character> {

        private final CharSequence pattern;
        private final boolean live;

        public StringRule(CharSequence pattern, boolean live) {
            if (pattern == null)
                throw new NullPointerException(
                    "String pattern may not be null");
            this.pattern = (live) ? pattern : pattern.toString();
            this.live = live;
        }
        public StringRule(String pattern) {
            this(pattern, false);
        }

        protected String toStringBase() {
            String ret = Formats.formatString(pattern);
            return (live) ? "ref" + ret : ret;
        }

        public boolean isLive() {
            return live;
        }

        public MatchResult match(Input<Character> input, int begin,
                                 int end) {
            int len = pattern.length();
            if (len == 0) return MatchResult.of(true, begin);
            if (end - begin < len) return MatchResult.failure(begin);
            for (int i = 0; i < len; i++) {
                if (input.get(begin + i) != pattern.charAt(i))
                    return MatchResult.failure(begin);
            }
            return MatchResult.success(begin + len, begin);
        }

    }

    public static class TokensRule<E> extends AbstractRule<E> {

        private final List<E> tokens;

        public TokensRule(List<E> tokens) {
            if (tokens == null)
                throw new NullPointerException(
                    "Token sequence may not be null");
            for (E t : tokens) {
                if (t == null)
                    throw new NullPointerException(
                        "Tokens may not be null");
            }
            this.tokens = Collections.unmodifiableList(
                new ArrayList<E>(tokens));
        }

        protected String toStringBase() {
            return "tokens" + tokens;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            int len = tokens.size();
            if (end - begin < len) return MatchResult.failure(begin);
            for (int i = 0; i < len; i++) {
                if (! tokens.get(i).equals(input.get(begin + i)))
                    return MatchResult.failure(begin);
            }
            return MatchResult.of(true, begin + len, begin);
        }

    }

    public static class PredicateRule<E> extends AbstractRule<E> {

        private final ElementPredicate<? super E> predicate;

        public PredicateRule(ElementPredicate<? super E> predicate) {
            if (predicate == null)
                throw new NullPointerException(
                    "Predicate may not be null");
            this.predicate = predicate;
        }

        protected String toStringBase() {
            return "is(" + predicate + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            if (begin == end) return MatchResult.failure(begin);
            return MatchResult.of(predicate.test(input.get(begin)),
                                  begin + 1, begin);
        }

    }

    public static class PredicateRunRule<E> extends AbstractRule<E> {

        private final ElementPredicate<? super E> predicate;
        private final int minOccurrence;
        private final int maxOccurrence;

        public PredicateRunRule(ElementPredicate<? super E> predicate,
                                int minOccurrence, int maxOccurrence) {
            if (predicate == null)
                throw new NullPointerException(
                    "Predicate may not be null");
            Rules.checkBounds(minOccurrence, maxOccurrence);
            this.predicate = predicate;
            this.minOccurrence = minOccurrence;
            this.maxOccurrence = maxOccurrence;
        }
        public PredicateRunRule(ElementPredicate<? super E> predicate) {
            this(predicate, 0, Rules.UNBOUNDED);
        }

        protected String toStringBase() {
            return "run(" + predicate + Rules.formatBounds(minOccurrence,
                maxOccurrence) + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            int i = begin, count = 0;
            while (count < maxOccurrence && i != end &&
                   predicate.test(input.get(i))) {
                i++;
                count++;
            }
            return MatchResult.of(count >= minOccurrence, i, begin);
        }

    }

    public static class IdentifierRule extends AbstractRule<Character> {

        private final PredicateRule<Character> head;
        private final PredicateRunRule<Character> tail;

        public IdentifierRule() {
            head = new PredicateRule<Character>(Predicates.alpha());
            tail = new PredicateRunRule<Character>(Predicates.alnum());
        }

        protected String toStringBase() {
            return "identifier";
        }

        public MatchResult match(Input<Character> input, int begin,
                                 int end) {
            MatchResult r = head.match(input, begin, end);
            if (! r.isMatched()) return r;
            r = tail.match(input, r.getPosition(), end);
            return MatchResult.success(r.getPosition(), begin);
        }

    }

    public static class EndRule<E> extends AbstractRule<E> {

        protected String toStringBase() {
            return "end";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            return MatchResult.of(begin == end, begin);
        }

    }

    public static class AdvanceRule<E> extends AbstractRule<E> {

        private final int offset;

        public AdvanceRule(int offset) {
            if (offset < 0)
                throw new IllegalArgumentException("Advance offset may " +
                    "not be negative");
            this.offset = offset;
        }

        protected String toStringBase() {
            return "advance(" + offset + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            return MatchResult.of(end - begin >= offset, begin + offset,
                                  begin);
        }

    }

    // Prevent construction.
    private Terminals() {}

}
