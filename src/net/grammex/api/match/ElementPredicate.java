package net.grammex.api.match;

/**
 * A stateless classifier for single input elements.
 * The Predicates class contains common character classes and combinators.
 */
public interface ElementPredicate<E> {

    /**
     * Whether the given element is accepted.
     */
    boolean test(E element);

}
