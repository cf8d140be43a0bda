package com.luacomposer.core.discovery;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Role-tagged files of a project.
 *
 * @param sourceDirectory absolute source root
 * @param header optional header file
 * @param namespace namespace file
 * @param entrypoint entrypoint file
 * @param footer optional footer file
 * @param coreFiles every other {@code .lua} file, sorted by relative path
 */
public record ProjectLayout(
    Path sourceDirectory,
    SourceFile header,
    SourceFile namespace,
    SourceFile entrypoint,
    SourceFile footer,
    List<SourceFile> coreFiles
) {
    public ProjectLayout {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(entrypoint, "entrypoint must not be null");
        coreFiles = coreFiles != null ? List.copyOf(coreFiles) : List.of();
    }

    /**
     * @return every file, role files first, then core files
     */
    public List<SourceFile> allFiles() {
        List<SourceFile> all = new ArrayList<>();
        if (header != null) {
            all.add(header);
        }
        all.add(namespace);
        all.add(entrypoint);
        if (footer != null) {
            all.add(footer);
        }
        all.addAll(coreFiles);
        return all;
    }
}
