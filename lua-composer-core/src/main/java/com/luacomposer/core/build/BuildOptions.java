package com.luacomposer.core.build;

import com.luacomposer.core.model.ScopeMode;

import java.time.Clock;
import java.util.Objects;

/**
 * Options threaded through a build.
 *
 * @param strict whether strict-only sanitization rules apply
 * @param scope scope mode of the output
 * @param clock clock for the banner timestamp
 */
public record BuildOptions(boolean strict, ScopeMode scope, Clock clock) {

    public BuildOptions {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }

    public static BuildOptions defaults() {
        return new BuildOptions(true, ScopeMode.GLOBAL, Clock.systemUTC());
    }
}
