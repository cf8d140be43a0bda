package com.luacomposer.core.error;

/**
 * Thrown when a literal {@code require} names a module that is unknown, or one
 * that is only placed after the requiring code in the composed output.
 */
public class UnresolvedDependencyException extends ComposerException {

    private final String target;

    public UnresolvedDependencyException(String modulePath, String target, int line, int column, String reason) {
        super("Unresolved require('" + target + "') in " + modulePath + " at line " + line + ":" + column
            + ": " + reason, modulePath, line, column);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
