package com.luacomposer.core.model;

/**
 * Non-fatal conditions reported after a successful build.
 */
public enum WarningCode {
    /** A {@code require} whose argument is not a single string literal; no ordering edge is added. */
    DYNAMIC_REQUIRE,
    /** A {@code loadlib} call was removed. */
    LOADLIB_REMOVED,
    /** A removed call sat inside a non-removable statement and was replaced by {@code nil}. */
    CALL_REPLACED_WITH_NIL,
    /** A declared license could not be fetched; the dependency is emitted without it. */
    LICENSE_UNAVAILABLE,
    /** An edit partly overlapped another edit and was not applied. */
    EDIT_SKIPPED
}
