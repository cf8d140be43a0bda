package com.luacomposer.core.compose;

import com.luacomposer.core.model.Module;

import java.util.Objects;

/**
 * A module paired with the text that goes into the output.
 *
 * @param module discovered module
 * @param text sanitized text, or the raw source for header and footer
 */
public record ComposedModule(Module module, String text) {

    public ComposedModule {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ComposedModule verbatim(Module module) {
        return new ComposedModule(module, module.source());
    }
}
