package com.luacomposer.core.error;

import java.util.List;

/**
 * Thrown when the core modules cannot be ordered because of a circular require.
 *
 * <p>Reports every module that could not be emitted, sorted, rather than a
 * single offending edge.
 */
public class CycleException extends ComposerException {

    private final List<String> remaining;

    public CycleException(List<String> remaining) {
        super("Circular dependency detected among modules: " + String.join(", ", remaining));
        this.remaining = List.copyOf(remaining);
    }

    /**
     * Returns the identities left unsorted when no module was eligible any more.
     *
     * @return sorted module identities
     */
    public List<String> getRemaining() {
        return remaining;
    }
}
