package com.luacomposer.core.compose;

import java.util.Objects;

/**
 * One named piece of the composed script, markers included.
 *
 * @param kind section kind
 * @param name module identity, file path or a fixed label
 * @param content final text of the section
 */
public record Section(SectionKind kind, String name, String content) {

    public Section {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
