package com.luacomposer.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whether the composed body is wrapped in a {@code do ... end} block.
 */
public enum ScopeMode {
    GLOBAL("global"),
    LOCAL("local");

    private final String id;

    ScopeMode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Looks up a scope by its configuration value, ignoring case.
     *
     * @param id {@code global} or {@code local}
     * @return the matching scope, or empty if the value is unknown
     */
    public static Optional<ScopeMode> fromId(String id) {
        return Arrays.stream(values())
            .filter(mode -> mode.id.equalsIgnoreCase(id == null ? "" : id.trim()))
            .findFirst();
    }
}
