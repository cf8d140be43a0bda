package com.luacomposer.core.sanitizer;

/**
 * What happens to a node matched by a {@link SanitizationRule}.
 */
public enum RuleAction {
    /** Abort sanitization of the module. */
    FAIL,
    /** Replace the callee of the matched call, keeping its arguments. */
    REWRITE_CALLEE,
    /** Remove the enclosing statement, or replace the call with {@code nil} where that is impossible. */
    REMOVE_STATEMENT,
    /** Delete every source line of the enclosing statement. */
    REMOVE_LINES
}
