package com.luacomposer.core.dependency;

import com.luacomposer.core.model.ExternalDependency;
import com.luacomposer.core.model.SourceKind;

import java.util.List;

/**
 * Formats fetched dependencies as commented blocks for injection into the output.
 *
 * <p>Each block looks like:
 * <pre>
 * -- External Dependency: name
 * -- Description: ...
 * -- Source: ...
 * -- File: ...
 * -- License:
 * -- ...
 *
 * content
 * </pre>
 * Description, File (GitHub releases only) and License lines appear only when
 * present. Dependency content is injected unmodified.
 */
public final class DependencySequencer {

    private DependencySequencer() {
        // Utility class
    }

    public static String format(List<ExternalDependency> dependencies) {
        StringBuilder out = new StringBuilder();
        for (ExternalDependency dependency : dependencies) {
            out.append(formatBlock(dependency)).append('\n');
        }
        return out.toString();
    }

    static String formatBlock(ExternalDependency dependency) {
        StringBuilder block = new StringBuilder();
        block.append("\n-- External Dependency: ").append(dependency.name()).append('\n');
        if (dependency.description() != null && !dependency.description().isBlank()) {
            block.append("-- Description: ").append(dependency.description()).append('\n');
        }
        block.append("-- Source: ").append(dependency.source()).append('\n');
        if (dependency.kind() == SourceKind.GITHUB_RELEASE && dependency.file() != null) {
            block.append("-- File: ").append(dependency.file()).append('\n');
        }
        if (dependency.license() != null && !dependency.license().isBlank()) {
            block.append("-- License:\n");
            for (String line : dependency.license().strip().split("\\R", -1)) {
                block.append(line.isBlank() ? "--" : "-- " + line).append('\n');
            }
        }
        block.append('\n');
        block.append(dependency.content());
        return block.toString();
    }
}
