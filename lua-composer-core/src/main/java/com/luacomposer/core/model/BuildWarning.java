package com.luacomposer.core.model;

import java.util.Objects;

/**
 * A warning raised while building.
 *
 * @param code warning kind
 * @param location module path or dependency name the warning refers to
 * @param line 1-based line, or {@code 0} when not tied to a line
 * @param message human-readable detail
 */
public record BuildWarning(WarningCode code, String location, int line, String message) {

    public BuildWarning {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        String where = line > 0 ? location + ":" + line : location;
        return code + " [" + where + "] " + message;
    }
}
