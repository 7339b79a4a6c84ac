package net.grammex.util.match;

import net.grammex.api.match.FailureHandler;
import net.grammex.api.match.MatchAction;
import net.grammex.api.match.Rule;

/**
 * Base class of all built-in rules.
 * Besides a readable toString(), an AbstractRule offers the rule algebra as
 * methods: a.and(b) is the sequence of a and b, a.or(b) the ordered choice
 * between them, and so on. Every method returns a new rule and leaves the
 * receiver unchanged. The same operations are available as static methods
 * of the Rules class.
 */
public abstract class AbstractRule<E> implements Rule<E> {

    public String toString() {
        return toStringBase();
    }

    /**
     * A description of this rule's expression.
     */
    protected abstract String toStringBase();

    /**
     * Whether toString() needs to be parenthesized when embedded into
     * another expression.
     */
    protected boolean isCompound() {
        return false;
    }

    /**
     * Match this rule, then next from where this rule stopped.
     */
    public AbstractRule<E> and(Rule<E> next) {
        return new Composites.AndRule<E>(this, next);
    }

    /**
     * Match this rule or, if it fails, alternative.
     */
    public AbstractRule<E> or(Rule<E> alternative) {
        return new Composites.OrRule<E>(this, alternative);
    }

    /**
     * Match exactly one of this rule and other.
     */
    public AbstractRule<E> xor(Rule<E> other) {
        return new Composites.XorRule<E>(this, other);
    }

    /**
     * Match this rule unless excluded matches at the same position.
     */
    public AbstractRule<E> minus(Rule<E> excluded) {
        return new Composites.AndRule<E>(
            new Composites.NotRule<E>(excluded), this);
    }

    /**
     * Succeed (without consuming anything) iff this rule does not match.
     */
    public AbstractRule<E> not() {
        return new Composites.NotRule<E>(this);
    }

    /**
     * Match this rule if possible; succeed in any case.
     */
    public AbstractRule<E> optional() {
        return new Composites.OptRule<E>(this);
    }

    /**
     * Match this rule between min and max times (both inclusive).
     * Use Rules.UNBOUNDED as max for no upper limit.
     */
    public AbstractRule<E> many(int min, int max) {
        return new Composites.ManyRule<E>(this, null, min, max);
    }

    /**
     * Match this rule between min and max times with separator matched
     * between any two repetitions.
     */
    public AbstractRule<E> many(Rule<E> separator, int min, int max) {
        if (separator == null)
            throw new NullPointerException(
                "Repetition separator may not be null");
        return new Composites.ManyRule<E>(this, separator, min, max);
    }

    /**
     * Match this rule any amount of times (including zero).
     */
    public AbstractRule<E> zeroOrMore() {
        return many(0, Rules.UNBOUNDED);
    }

    /**
     * Match this rule at least once.
     */
    public AbstractRule<E> oneOrMore() {
        return many(1, Rules.UNBOUNDED);
    }

    /**
     * Match this rule at least once, with separator between repetitions.
     */
    public AbstractRule<E> separatedBy(Rule<E> separator) {
        return many(separator, 1, Rules.UNBOUNDED);
    }

    /**
     * Skip input elements until this rule matches.
     */
    public AbstractRule<E> find() {
        return new Composites.FindRule<E>(this);
    }

    /**
     * Match this rule, but report the starting position in any case.
     */
    public AbstractRule<E> test() {
        return new Composites.TestRule<E>(this);
    }

    /**
     * Invoke handler whenever this rule fails.
     * Typically applied to the last alternative of a choice, as in
     * a.or(b).orFail(handler).
     */
    public AbstractRule<E> orFail(FailureHandler<E> handler) {
        return new Composites.FailRule<E>(this, handler);
    }

    /**
     * Invoke action with the matched span whenever this rule matches.
     */
    public AbstractRule<E> onMatch(MatchAction<E> action) {
        return new Composites.ActionRule<E>(this, action);
    }

    /**
     * Return a rule that behaves like this one but describes itself as
     * name.
     */
    public AbstractRule<E> named(String name) {
        return new Composites.NamedRule<E>(name, this);
    }

    /**
     * Format an operand for inclusion into a compound description.
     */
    protected static String describe(Rule<?> r) {
        if (r instanceof AbstractRule && ((AbstractRule<?>) r).isCompound())
            return "(" + r + ")";
        return String.valueOf(r);
    }

}
