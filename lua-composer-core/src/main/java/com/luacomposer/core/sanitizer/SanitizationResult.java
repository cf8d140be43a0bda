package com.luacomposer.core.sanitizer;

import java.util.Objects;

/**
 * Sanitized text of a module with its report. When the report is fatal the
 * text is the unmodified input.
 */
public record SanitizationResult(String text, SanitizationReport report) {

    public SanitizationResult {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }
}
