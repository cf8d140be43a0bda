package com.luacomposer.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an external dependency is fetched from.
 */
public enum SourceKind {
    /** An asset of a GitHub release, declared as {@code owner/repo@tag}. */
    GITHUB_RELEASE("github_release"),
    /** A plain HTTP(S) URL. */
    URL("url"),
    /** A file relative to the project base directory. */
    LOCAL("local");

    private final String id;

    SourceKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<SourceKind> fromId(String id) {
        return Arrays.stream(values()).filter(kind -> kind.id.equals(id)).findFirst();
    }
}
