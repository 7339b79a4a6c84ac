package net.grammex.util.match;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammex.api.match.FailureHandler;
import net.grammex.api.match.Input;
import net.grammex.api.match.MatchAction;
import net.grammex.api.match.MatchResult;
import net.grammex.api.match.Rule;
import net.grammex.util.Logging;

/**
 * Rules built from other rules.
 * Every composite reports the position it was started at when it fails,
 * regardless of how far its operands got. Capture side effects of operands
 * are never undone.
 */
public final class Composites {

    /* Base for combinators with a single operand. */
    public static abstract class UnaryRule<E> extends AbstractRule<E> {

        private final Rule<E> operand;

        public UnaryRule(Rule<E> operand, String what) {
            if (operand == null)
                throw new NullPointerException(what + " operand may not " +
                    "be null");
            this.operand = operand;
        }

        public Rule<E> getOperand() {
            return operand;
        }

    }

    /* Base for combinators with two operands. */
    public static abstract class BinaryRule<E> extends AbstractRule<E> {

        private final Rule<E> left;
        private final Rule<E> right;

        public BinaryRule(Rule<E> left, Rule<E> right, String what) {
            if (left == null || right == null)
                throw new NullPointerException(what + " operand may not " +
                    "be null");
            this.left = left;
            this.right = right;
        }

        protected String toStringBase() {
            return describe(left) + " " + getOperator() + " " +
                describe(right);
        }

        protected boolean isCompound() {
            return true;
        }

        protected abstract String getOperator();

        public Rule<E> getLeft() {
            return left;
        }

        public Rule<E> getRight() {
            return right;
        }

    }

    public static class AndRule<E> extends BinaryRule<E> {

        public AndRule(Rule<E> left, Rule<E> right) {
            super(left, right, "Sequence");
        }

        protected String getOperator() {
            return "&";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getLeft().match(input, begin, end);
            if (! r.isMatched()) return MatchResult.failure(begin);
            r = getRight().match(input, r.getPosition(), end);
            if (! r.isMatched()) return MatchResult.failure(begin);
            return MatchResult.success(r.getPosition(), begin);
        }

    }

    public static class OrRule<E> extends BinaryRule<E> {

        public OrRule(Rule<E> left, Rule<E> right) {
            super(left, right, "Alternative");
        }

        protected String getOperator() {
            return "|";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getLeft().match(input, begin, end);
            if (! r.isMatched()) r = getRight().match(input, begin, end);
            return MatchResult.of(r.isMatched(), r.getPosition(), begin);
        }

    }

    public static class XorRule<E> extends BinaryRule<E> {

        public XorRule(Rule<E> left, Rule<E> right) {
            super(left, right, "Exclusive alternative");
        }

        protected String getOperator() {
            return "^";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult l = getLeft().match(input, begin, end);
            MatchResult r = getRight().match(input, begin, end);
            if (l.isMatched() == r.isMatched())
                return MatchResult.failure(begin);
            MatchResult winner = (l.isMatched()) ? l : r;
            return MatchResult.success(winner.getPosition(), begin);
        }

    }

    public static class NotRule<E> extends UnaryRule<E> {

        public NotRule(Rule<E> operand) {
            super(operand, "Negation");
        }

        protected String toStringBase() {
            return "!" + describe(getOperand());
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getOperand().match(input, begin, end);
            return MatchResult.of(! r.isMatched(), begin);
        }

    }

    public static class OptRule<E> extends UnaryRule<E> {

        public OptRule(Rule<E> operand) {
            super(operand, "Option");
        }

        protected String toStringBase() {
            return "~" + describe(getOperand());
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getOperand().match(input, begin, end);
            return MatchResult.success((r.isMatched()) ? r.getPosition() :
                                       begin, begin);
        }

    }

    /* A zero-width repetition (rule and separator both consuming nothing)
     * is counted once and ends the loop; it would match forever
     * otherwise. */
    public static class ManyRule<E> extends UnaryRule<E> {

        private final Rule<E> separator;
        private final int minOccurrence;
        private final int maxOccurrence;

        public ManyRule(Rule<E> operand, Rule<E> separator,
                        int minOccurrence, int maxOccurrence) {
            super(operand, "Repetition");
            Rules.checkBounds(minOccurrence, maxOccurrence);
            this.separator = separator;
            this.minOccurrence = minOccurrence;
            this.maxOccurrence = maxOccurrence;
        }

        protected String toStringBase() {
            StringBuilder sb = new StringBuilder("many(");
            sb.append(getOperand());
            if (separator != null) sb.append(", ").append(separator);
            sb.append(Rules.formatBounds(minOccurrence, maxOccurrence));
            return sb.append(')').toString();
        }

        public Rule<E> getSeparator() {
            return separator;
        }

        public int getMinOccurrence() {
            return minOccurrence;
        }

        public int getMaxOccurrence() {
            return maxOccurrence;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            int position = begin, count = 0;
            while (count < maxOccurrence) {
                int next = position;
                if (count > 0 && separator != null) {
                    MatchResult s = separator.match(input, next, end);
                    if (! s.isMatched()) break;
                    next = s.getPosition();
                }
                MatchResult r = getOperand().match(input, next, end);
                if (! r.isMatched()) break;
                count++;
                boolean stalled = (r.getPosition() == position);
                position = r.getPosition();
                if (stalled) break;
            }
            return MatchResult.of(count >= minOccurrence, position, begin);
        }

    }

    public static class FindRule<E> extends UnaryRule<E> {

        public FindRule(Rule<E> operand) {
            super(operand, "Search");
        }

        protected String toStringBase() {
            return "find(" + getOperand() + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            for (int i = begin; i <= end; i++) {
                MatchResult r = getOperand().match(input, i, end);
                if (r.isMatched())
                    return MatchResult.success(r.getPosition(), begin);
            }
            return MatchResult.failure(begin);
        }

    }

    public static class SelectRule<E> extends AbstractRule<E> {

        private final Rule<E> condition;
        private final Rule<E> consequence;
        private final Rule<E> alternative;

        public SelectRule(Rule<E> condition, Rule<E> consequence,
                          Rule<E> alternative) {
            if (condition == null || consequence == null ||
                    alternative == null)
                throw new NullPointerException(
                    "Selection operands may not be null");
            this.condition = condition;
            this.consequence = consequence;
            this.alternative = alternative;
        }

        protected String toStringBase() {
            return "select(" + condition + ", " + consequence + ", " +
                alternative + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult c = condition.match(input, begin, end);
            MatchResult r;
            if (c.isMatched()) {
                r = consequence.match(input, c.getPosition(), end);
            } else {
                r = alternative.match(input, begin, end);
            }
            return MatchResult.of(r.isMatched(), r.getPosition(), begin);
        }

    }

    public static class TestRule<E> extends UnaryRule<E> {

        public TestRule(Rule<E> operand) {
            super(operand, "Lookahead");
        }

        protected String toStringBase() {
            return "test(" + getOperand() + ")";
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getOperand().match(input, begin, end);
            return MatchResult.of(r.isMatched(), begin);
        }

    }

    public static class FailRule<E> extends UnaryRule<E> {

        private final FailureHandler<E> handler;

        public FailRule(Rule<E> operand, FailureHandler<E> handler) {
            super(operand, "Failure hook");
            if (handler == null)
                throw new NullPointerException(
                    "Failure handler may not be null");
            this.handler = handler;
        }

        protected String toStringBase() {
            return describe(getOperand()) + " | fail(" + handler + ")";
        }

        protected boolean isCompound() {
            return true;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getOperand().match(input, begin, end);
            if (r.isMatched()) return r;
            handler.onFailure(input, begin, end);
            return MatchResult.failure(begin);
        }

    }

    public static class ActionRule<E> extends UnaryRule<E> {

        private final MatchAction<E> action;

        public ActionRule(Rule<E> operand, MatchAction<E> action) {
            super(operand, "Action");
            if (action == null)
                throw new NullPointerException(
                    "Match action may not be null");
            this.action = action;
        }

        protected String toStringBase() {
            return describe(getOperand()) + " >> " + action;
        }

        protected boolean isCompound() {
            return true;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            MatchResult r = getOperand().match(input, begin, end);
            if (r.isMatched()) action.apply(input, begin, r.getPosition());
            return r;
        }

    }

    public static class NamedRule<E> extends UnaryRule<E> {

        private final String name;

        public NamedRule(String name, Rule<E> operand) {
            super(operand, "Named rule");
            if (name == null)
                throw new NullPointerException(
                    "Rule name may not be null");
            this.name = name;
        }

        protected String toStringBase() {
            return name;
        }

        public String getName() {
            return name;
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            return getOperand().match(input, begin, end);
        }

    }

    public static class TraceRule<E> extends NamedRule<E> {

        private static final Logger LOGGER =
            Logger.getLogger(Logging.TRACE_LOGGER);

        public TraceRule(String name, Rule<E> operand) {
            super(name, operand);
        }

        public MatchResult match(Input<E> input, int begin, int end) {
            if (LOGGER.isLoggable(Level.FINER))
                LOGGER.finer("Trying " + getName() + " at " + begin);
            MatchResult r = getOperand().match(input, begin, end);
            if (LOGGER.isLoggable(Level.FINE)) {
                if (r.isMatched()) {
                    LOGGER.fine(getName() + " matched " + begin + ".." +
                                r.getPosition());
                } else {
                    LOGGER.fine(getName() + " failed at " + begin);
                }
            }
            return r;
        }

    }

    // Prevent construction.
    private Composites() {}

}
