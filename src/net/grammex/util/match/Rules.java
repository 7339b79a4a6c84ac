package net.grammex.util.match;

import java.util.Collection;
import java.util.List;
import net.grammex.api.match.BinaryLayout;
import net.grammex.api.match.Decision;
import net.grammex.api.match.ElementPredicate;
import net.grammex.api.match.FailureHandler;
import net.grammex.api.match.MatchAction;
import net.grammex.api.match.Rule;
import net.grammex.api.match.Variable;

/**
 * Static construction surface for rules.
 * Grammars are written by combining the terminals and combinators here,
 * e.g.
 *     Rule<Character> list = sepBy(identifier(), ch(','));
 * The combinators are also available as methods of AbstractRule.
 */
public final class Rules {

    /**
     * Upper repetition bound standing for "no limit".
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final AbstractRule<Character> DIGITS =
        run(Predicates.digit(), 1, UNBOUNDED).named("digits");

    private static final AbstractRule<Character> SIGN =
        is(Predicates.oneOf("+-"));

    private static final AbstractRule<Character> DECIMAL =
        SIGN.optional().and(DIGITS).named("decimal");

    private static final AbstractRule<Character> FLOATING_POINT =
        SIGN.optional()
            .and(DIGITS.and(ch('.').and(run(Predicates.digit())).optional())
                 .or(ch('.').and(DIGITS)))
            .and(is(Predicates.oneOf("eE")).and(SIGN.optional())
                 .and(DIGITS).optional())
            .named("floatingPoint");

    /* Prevent construction */
    private Rules() {}

    static void checkBounds(int min, int max) {
        if (min < 0)
            throw new IllegalArgumentException("Minimum occurrence may " +
                "not be negative");
        if (max < min)
            throw new IllegalArgumentException("Maximum occurrence " + max +
                " is less than minimum " + min);
    }

    static String formatBounds(int min, int max) {
        if (min == 0 && max == UNBOUNDED) return "";
        return ", " + min + ".." + ((max == UNBOUNDED) ? "" :
            String.valueOf(max));
    }

    static void checkLayout(BinaryLayout<?> layout) {
        if (layout == null)
            throw new NullPointerException(
                "Binary layout may not be null");
        if (layout.getWidth() <= 0)
            throw new IllegalArgumentException("Binary layout " + layout +
                " has non-positive width");
    }

    /**
     * Give any Rule the algebra methods of AbstractRule.
     */
    public static <E> AbstractRule<E> wrap(Rule<E> rule) {
        if (rule instanceof AbstractRule) return (AbstractRule<E>) rule;
        return new Composites.NamedRule<E>(String.valueOf(rule), rule);
    }

    /* Terminals */

    /**
     * A rule that always matches without consuming anything.
     */
    public static <E> AbstractRule<E> empty() {
        return new Terminals.EmptyRule<E>();
    }

    /**
     * A rule that matches (without consuming anything) iff value is true.
     */
    public static <E> AbstractRule<E> bool(boolean value) {
        return new Terminals.BoolRule<E>(value);
    }

    /**
     * A rule that matches (without consuming anything) iff decision, which
     * is consulted every time the rule is matched, says so.
     */
    public static <E> AbstractRule<E> bool(Decision decision) {
        return new Terminals.BoolRule<E>(decision);
    }

    /**
     * A rule that matches the single character ch.
     */
    public static AbstractRule<Character> ch(char ch) {
        return new Terminals.ElementRule<Character>(ch);
    }

    /**
     * A rule that matches a single element equal to token.
     */
    public static <E> AbstractRule<E> token(E token) {
        return new Terminals.ElementRule<E>(token);
    }

    /**
     * A rule that matches any single element.
     */
    public static <E> AbstractRule<E> any() {
        return new Terminals.AnyRule<E>();
    }

    /**
     * A rule that matches the given bytes.
     */
    public static AbstractRule<Byte> bin(byte... pattern) {
        return new Terminals.BinaryPatternRule(pattern);
    }

    /**
     * A rule that matches the binary representation of value.
     */
    public static <T> AbstractRule<Byte> bin(T value,
                                             BinaryLayout<T> layout) {
        checkLayout(layout);
        return new Terminals.BinaryPatternRule(layout.encode(value));
    }

    /**
     * A rule that matches the characters of pattern.
     * The pattern is copied; an empty pattern always matches.
     */
    public static AbstractRule<Character> str(String pattern) {
        return new Terminals.StringRule(pattern, false);
    }

    /**
     * A rule that matches the current characters of pattern.
     * The pattern is not copied but read whenever the rule is matched, so
     * that e.g. a StringBuilder can be changed between matches.
     */
    public static AbstractRule<Character> strRef(CharSequence pattern) {
        return new Terminals.StringRule(pattern, true);
    }

    /**
     * A rule that matches the given elements in order.
     */
    public static <E> AbstractRule<E> tokens(List<E> tokens) {
        return new Terminals.TokensRule<E>(tokens);
    }

    /**
     * A rule that matches a single element accepted by predicate.
     */
    public static <E> AbstractRule<E> is(
            ElementPredicate<? super E> predicate) {
        return new Terminals.PredicateRule<E>(predicate);
    }

    /**
     * A rule that matches the longest (possibly empty) run of elements
     * accepted by predicate.
     */
    public static <E> AbstractRule<E> run(
            ElementPredicate<? super E> predicate) {
        return new Terminals.PredicateRunRule<E>(predicate);
    }

    /**
     * A rule that matches the longest run of at most max elements accepted
     * by predicate, and fails if that run is shorter than min.
     */
    public static <E> AbstractRule<E> run(
            ElementPredicate<? super E> predicate, int min, int max) {
        return new Terminals.PredicateRunRule<E>(predicate, min, max);
    }

    /**
     * A rule that matches a single character between lo and hi (both
     * inclusive).
     */
    public static AbstractRule<Character> range(char lo, char hi) {
        return is(Predicates.range(lo, hi));
    }

    /**
     * A rule that matches a single character contained in chars.
     */
    public static AbstractRule<Character> anyOf(String chars) {
        return is(Predicates.oneOf(chars));
    }

    /**
     * A rule that matches a possibly empty run of whitespace.
     */
    public static AbstractRule<Character> spaces() {
        return run(Predicates.space());
    }

    /**
     * A rule that matches a letter followed by any amount of letters and
     * digits.
     */
    public static AbstractRule<Character> identifier() {
        return new Terminals.IdentifierRule();
    }

    /**
     * A rule that matches (without consuming anything) only at the end of
     * the input range.
     */
    public static <E> AbstractRule<E> end() {
        return new Terminals.EndRule<E>();
    }

    /**
     * A rule that skips exactly offset elements, failing if there are
     * fewer remaining.
     */
    public static <E> AbstractRule<E> advance(int offset) {
        return new Terminals.AdvanceRule<E>(offset);
    }

    /**
     * A rule that reads one value of the given layout into destination.
     */
    public static <T> AbstractRule<Byte> var(Variable<T> destination,
                                             BinaryLayout<T> layout) {
        return new Captures.VariableRule<T>(destination, layout);
    }

    /**
     * A rule that fills destination with values of the given layout.
     */
    public static <T> AbstractRule<Byte> array(T[] destination,
                                               BinaryLayout<T> layout) {
        return new Captures.ArrayRule<T>(destination, layout);
    }

    /**
     * A rule that clears destination and reads between min and max values
     * of the given layout into it.
     */
    public static <T> AbstractRule<Byte> collect(
            Collection<? super T> destination, BinaryLayout<T> layout,
            int min, int max) {
        return new Captures.CollectRule<T>(destination, layout, min, max);
    }

    /* Numbers */

    /**
     * One or more decimal digits.
     */
    public static AbstractRule<Character> digits() {
        return DIGITS;
    }

    /**
     * An unsigned decimal integer (an alias of digits()).
     */
    public static AbstractRule<Character> unsignedDecimal() {
        return DIGITS;
    }

    /**
     * A decimal integer with an optional sign.
     */
    public static AbstractRule<Character> decimal() {
        return DECIMAL;
    }

    /**
     * A floating-point literal with optional sign, fraction, and exponent,
     * as in "-1.5e3", "2.", or ".25".
     */
    public static AbstractRule<Character> floatingPoint() {
        return FLOATING_POINT;
    }

    /* Combinators */

    /**
     * Match the given rules one after another.
     */
    @SafeVarargs
    public static <E> AbstractRule<E> sequence(Rule<E> first,
                                               Rule<E>... rest) {
        AbstractRule<E> ret = wrap(first);
        for (Rule<E> r : rest) ret = new Composites.AndRule<E>(ret, r);
        return ret;
    }

    /**
     * Match the first of the given rules that matches.
     */
    @SafeVarargs
    public static <E> AbstractRule<E> alt(Rule<E> first, Rule<E>... rest) {
        AbstractRule<E> ret = wrap(first);
        for (Rule<E> r : rest) ret = new Composites.OrRule<E>(ret, r);
        return ret;
    }

    /**
     * Succeed without consuming anything iff rule fails.
     */
    public static <E> AbstractRule<E> not(Rule<E> rule) {
        return new Composites.NotRule<E>(rule);
    }

    /**
     * Match rule if possible; succeed in any case.
     */
    public static <E> AbstractRule<E> opt(Rule<E> rule) {
        return new Composites.OptRule<E>(rule);
    }

    /**
     * Match rule between min and max times.
     */
    public static <E> AbstractRule<E> many(Rule<E> rule, int min, int max) {
        return new Composites.ManyRule<E>(rule, null, min, max);
    }

    /**
     * Match rule between min and max times, with separator between any
     * two repetitions.
     */
    public static <E> AbstractRule<E> many(Rule<E> rule, Rule<E> separator,
                                           int min, int max) {
        if (separator == null)
            throw new NullPointerException(
                "Repetition separator may not be null");
        return new Composites.ManyRule<E>(rule, separator, min, max);
    }

    /**
     * Match rule any amount of times.
     */
    public static <E> AbstractRule<E> zeroOrMore(Rule<E> rule) {
        return many(rule, 0, UNBOUNDED);
    }

    /**
     * Match rule at least once.
     */
    public static <E> AbstractRule<E> oneOrMore(Rule<E> rule) {
        return many(rule, 1, UNBOUNDED);
    }

    /**
     * Match rule at least once, with separator between the repetitions.
     */
    public static <E> AbstractRule<E> sepBy(Rule<E> rule, Rule<E> separator) {
        return many(rule, separator, 1, UNBOUNDED);
    }

    /**
     * Match exactly one of a and b.
     */
    public static <E> AbstractRule<E> xor(Rule<E> a, Rule<E> b) {
        return new Composites.XorRule<E>(a, b);
    }

    /**
     * Match rule unless excluded matches at the same position.
     */
    public static <E> AbstractRule<E> diff(Rule<E> rule, Rule<E> excluded) {
        return new Composites.AndRule<E>(new Composites.NotRule<E>(excluded),
                                         rule);
    }

    /**
     * Skip elements until rule matches.
     */
    public static <E> AbstractRule<E> find(Rule<E> rule) {
        return new Composites.FindRule<E>(rule);
    }

    /**
     * Match condition once; if it matched, continue with consequence,
     * otherwise match alternative in its place.
     */
    public static <E> AbstractRule<E> select(Rule<E> condition,
                                             Rule<E> consequence,
                                             Rule<E> alternative) {
        return new Composites.SelectRule<E>(condition, consequence,
                                            alternative);
    }

    /**
     * Match rule without consuming anything.
     */
    public static <E> AbstractRule<E> test(Rule<E> rule) {
        return new Composites.TestRule<E>(rule);
    }

    /**
     * Match rule, invoking handler if it fails.
     */
    public static <E> AbstractRule<E> fail(Rule<E> rule,
                                           FailureHandler<E> handler) {
        return new Composites.FailRule<E>(rule, handler);
    }

    /**
     * Match rule, invoking action with the matched span on success.
     */
    public static <E> AbstractRule<E> action(Rule<E> rule,
                                             MatchAction<E> action) {
        return new Composites.ActionRule<E>(rule, action);
    }

    /**
     * An unbound reference, to be bound with Reference.set().
     */
    public static <E> Reference<E> ref(String name) {
        return new Reference<E>(name);
    }

    /**
     * A reference to an existing rule.
     */
    public static <E> Reference<E> ref(Rule<E> rule) {
        return new Reference<E>(String.valueOf(rule), rule);
    }

    /**
     * Give rule a different description.
     */
    public static <E> AbstractRule<E> named(String name, Rule<E> rule) {
        return new Composites.NamedRule<E>(name, rule);
    }

    /**
     * Log every attempt to match rule (at FINER) and its outcome (at
     * FINE) to the "TraceRule" logger.
     */
    public static <E> AbstractRule<E> trace(String name, Rule<E> rule) {
        return new Composites.TraceRule<E>(name, rule);
    }

}
