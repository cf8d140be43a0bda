package com.luacomposer.core.util;

import java.nio.file.Path;

/**
 * Derives module identities, the dotted names {@code require} uses.
 */
public final class ModuleIdentity {

    private static final String LUA_EXTENSION = ".lua";

    private ModuleIdentity() {
        // Utility class
    }

    /**
     * Normalizes a required name: {@code /} or {@code \} separators become dots.
     * A trailing {@code .lua} is kept, since {@code require("lib.lua")} names
     * the file {@code lib/lua.lua}.
     *
     * @param name name as written in source
     * @return normalized identity
     */
    public static String normalize(String name) {
        return name.trim().replace('/', '.').replace('\\', '.');
    }

    /**
     * Builds the identity of a file from its path relative to the source root.
     *
     * @param relativePath path relative to the source directory, e.g. {@code util/strings.lua}
     * @return identity, e.g. {@code util.strings}
     */
    public static String of(Path relativePath) {
        String path = toPortable(relativePath);
        if (path.endsWith(LUA_EXTENSION)) {
            path = path.substring(0, path.length() - LUA_EXTENSION.length());
        }
        return normalize(path);
    }

    /**
     * Returns the directory key of a relative path: its parent with {@code /}
     * separators, or {@code ""} for files at the root.
     *
     * @param relativePath path relative to the source directory
     * @return directory key
     */
    public static String directoryKey(Path relativePath) {
        Path parent = relativePath.getParent();
        return parent == null ? "" : toPortable(parent);
    }

    /**
     * Renders a relative path with forward slashes on every platform.
     *
     * @param relativePath path to render
     * @return portable path string
     */
    public static String toPortable(Path relativePath) {
        return relativePath.toString().replace('\\', '/');
    }
}
