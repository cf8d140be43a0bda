package com.luacomposer.core.build;

import com.luacomposer.core.model.BuildWarning;

import java.util.List;
import java.util.Objects;

/**
 * Output of a successful build.
 *
 * @param text composed script
 * @param order core-module identities in emission order
 * @param warnings every warning raised, in the order raised
 */
public record BuildResult(String text, List<String> order, List<BuildWarning> warnings) {

    public BuildResult {
        Objects.requireNonNull(text, "text must not be null");
        order = List.copyOf(order);
        warnings = List.copyOf(warnings);
    }
}
