package com.luacomposer.core.model;

/**
 * Part a source file plays in the composed script.
 */
public enum ModuleRole {
    /** Copied verbatim before everything else. */
    HEADER,
    /** Sanitized, placed before the core modules. */
    NAMESPACE,
    /** Sanitized and ordered by dependencies. */
    CORE,
    /** Sanitized, placed after the core modules. */
    ENTRYPOINT,
    /** Copied verbatim after everything else. */
    FOOTER
}
