package com.luacomposer.core.compose;

/**
 * Kinds of section in a composed script, in emission order.
 */
public enum SectionKind {
    HEADER,
    BANNER,
    SCOPE_OPEN,
    DEPENDENCIES,
    NAMESPACE,
    CORE_MODULE,
    ENTRYPOINT,
    SCOPE_CLOSE,
    FOOTER
}
