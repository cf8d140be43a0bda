package com.luacomposer.core.sanitizer;

import com.luacomposer.core.error.ComposerException;
import com.luacomposer.core.model.BuildWarning;

import java.util.List;

/**
 * Outcome of sanitizing one module: warnings in the order they were raised and
 * at most one fatal condition.
 *
 * @param warnings non-fatal findings
 * @param fatal the condition that aborted the module, or {@code null}
 */
public record SanitizationReport(List<BuildWarning> warnings, ComposerException fatal) {

    public SanitizationReport {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isFatal() {
        return fatal != null;
    }

    /**
     * Rethrows the fatal condition, if any.
     *
     * @throws ComposerException the recorded fatal condition
     */
    public void throwIfFatal() {
        if (fatal != null) {
            throw fatal;
        }
    }
}
