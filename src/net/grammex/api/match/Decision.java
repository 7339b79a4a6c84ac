package net.grammex.api.match;

/**
 * A parameterless decision evaluated while matching.
 * Used to embed semantic conditions into a grammar; see Rules.bool().
 */
public interface Decision {

    /**
     * Whether the enclosing rule should match.
     */
    boolean decide();

}
