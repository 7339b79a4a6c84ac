package net.grammex.api.match;

/**
 * A mutable single-value capture destination.
 * Capturing rules bind to a Variable at construction and store into it
 * whenever they match; the embedding code reads the value back afterwards.
 * Variables are not synchronized.
 */
public class Variable<T> {

    private T value;
    private boolean set;

    public Variable() {}
    public Variable(T initial) {
        value = initial;
    }

    public String toString() {
        return "Variable[" + (set ? value : "(unset)") + "]";
    }

    /**
     * The current value (or the initial one if nothing has been captured
     * yet).
     */
    public T get() {
        return value;
    }

    /**
     * Replace the current value.
     */
    public void set(T v) {
        value = v;
        set = true;
    }

    /**
     * Whether set() has been called since construction or the last clear().
     */
    public boolean isSet() {
        return set;
    }

    /**
     * Reset this variable to null and mark it as not set.
     */
    public void clear() {
        value = null;
        set = false;
    }

}
