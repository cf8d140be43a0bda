package com.luacomposer.core.model;

import java.util.Objects;

/**
 * A literal {@code require} found in a module.
 *
 * @param identity normalized module identity that is required
 * @param line 1-based line of the call
 * @param column 0-based column of the call
 */
public record RequireReference(String identity, int line, int column) {

    public RequireReference {
        Objects.requireNonNull(identity, "identity must not be null");
    }
}
