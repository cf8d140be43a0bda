package com.luacomposer.core.discovery;

import com.luacomposer.core.model.ModuleRole;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A discovered file, not yet read.
 *
 * @param path absolute, normalized path
 * @param relativePath path relative to the source directory, {@code /} separated
 * @param identity dotted module identity
 * @param directoryKey relative parent directory, {@code ""} at the root
 * @param role part the file plays
 */
public record SourceFile(Path path, String relativePath, String identity, String directoryKey, ModuleRole role) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(directoryKey, "directoryKey must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public boolean isLua() {
        return relativePath.endsWith(".lua");
    }
}
