package com.luacomposer.core.model;

import java.util.Objects;

/**
 * A fetched third-party script, ready to be injected into the output.
 *
 * @param name unique dependency name, also usable as a {@code require} target
 * @param kind where it came from
 * @param source declared source (path, URL or {@code owner/repo@tag})
 * @param file release asset name, only for {@link SourceKind#GITHUB_RELEASE}
 * @param content fetched script content
 * @param license fetched license text, or {@code null}
 * @param description optional description
 */
public record ExternalDependency(
    String name,
    SourceKind kind,
    String source,
    String file,
    String content,
    String license,
    String description
) {
    public ExternalDependency {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
