package com.luacomposer.core.model;

import com.luacomposer.core.ast.LuaAst;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A discovered, read and parsed source file.
 *
 * <p>Header and footer files are carried verbatim and are never parsed; for
 * them {@link #chunk()} is {@code null} and {@link #requires()} is empty. A
 * {@code .lua} header or footer still has an identity other modules may require.
 *
 * @param identity dotted identity derived from the relative path
 * @param path absolute file path
 * @param relativePath path relative to the source directory, with {@code /} separators
 * @param directoryKey relative parent directory, {@code ""} at the root
 * @param role part the file plays in the output
 * @param source raw file content
 * @param chunk parsed tree, or {@code null} for verbatim non-Lua files
 * @param requires literal requires in source order, one per identity
 */
public record Module(
    String identity,
    Path path,
    String relativePath,
    String directoryKey,
    ModuleRole role,
    String source,
    LuaAst.Chunk chunk,
    List<RequireReference> requires
) {
    public Module {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(source, "source must not be null");
        directoryKey = directoryKey != null ? directoryKey : "";
        requires = requires != null ? List.copyOf(requires) : List.of();
    }

    public boolean isLua() {
        return chunk != null;
    }

    public boolean hasLuaExtension() {
        return relativePath.endsWith(".lua");
    }
}
