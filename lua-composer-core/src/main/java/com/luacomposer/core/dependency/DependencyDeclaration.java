package com.luacomposer.core.dependency;

import com.luacomposer.core.model.SourceKind;

import java.util.Objects;

/**
 * A validated external dependency declaration, not yet fetched.
 *
 * @param name unique name
 * @param kind source kind
 * @param source path, URL or {@code owner/repo@tag}
 * @param file release asset name; required for {@link SourceKind#GITHUB_RELEASE}, otherwise ignored
 * @param license license path, URL or release asset name, or {@code null}
 * @param description free text, or {@code null}
 */
public record DependencyDeclaration(
    String name,
    SourceKind kind,
    String source,
    String file,
    String license,
    String description
) {
    public DependencyDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    public boolean hasLicense() {
        return license != null && !license.isBlank();
    }
}
