package com.luacomposer.core.dependency;

import com.luacomposer.core.model.BuildWarning;

import java.util.List;
import java.util.Objects;

/**
 * Content fetched for one dependency.
 *
 * @param content script content
 * @param license license text, or {@code null} when none was declared or it could not be fetched
 * @param warnings non-fatal problems, e.g. an unavailable license
 */
public record FetchResult(String content, String license, List<BuildWarning> warnings) {

    public FetchResult {
        Objects.requireNonNull(content, "content must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
