package net.grammex.util.match;

import net.grammex.api.match.Input;
import net.grammex.api.match.MatchResult;
import net.grammex.api.match.Rule;

/**
 * An indirection to another rule, resolved at match time.
 * References make self-referential grammars possible: a Reference is
 * created first, used inside the rules that (directly or indirectly)
 * define it, and bound with set() afterwards. A Reference can be bound
 * exactly once; matching an unbound Reference is a programming error and
 * raises an IllegalStateException.
 * The description of a Reference is its name only, so that describing a
 * cyclic grammar terminates.
 */
public class Reference<E> extends AbstractRule<E> {

    private final String name;
    private Rule<E> target;

    public Reference(String name) {
        if (name == null)
            throw new NullPointerException(
                "Reference name may not be null");
        this.name = name;
    }
    public Reference(String name, Rule<E> target) {
        this(name);
        set(target);
    }
    public Reference() {
        this("<ref>");
    }

    protected String toStringBase() {
        return name;
    }

    public String getName() {
        return name;
    }

    /**
     * The rule this reference resolves to, or null if it is unbound.
     */
    public Rule<E> get() {
        return target;
    }

    /**
     * Whether this reference has been bound.
     */
    public boolean isBound() {
        return (target != null);
    }

    /**
     * Bind this reference to the given rule.
     */
    public void set(Rule<E> rule) {
        if (rule == null)
            throw new NullPointerException(
                "Reference target may not be null");
        if (target != null)
            throw new IllegalStateException("Reference " + name +
                " is already bound");
        target = rule;
    }

    public MatchResult match(Input<E> input, int begin, int end) {
        Rule<E> t = target;
        if (t == null)
            throw new IllegalStateException("Matching unbound reference " +
                name);
        return t.match(input, begin, end);
    }

}
