package com.luacomposer.core.error;

/**
 * Thrown when a sanitized module contains a {@code goto} statement. The mission
 * scripting runtime rejects {@code goto}, so this is fatal regardless of strict mode.
 */
public class GotoException extends ComposerException {

    public GotoException(String modulePath, int line, int column, String lineText) {
        super("Disallowed 'goto' statement found in " + modulePath + " on line " + line + ": " + lineText,
            modulePath, line, column);
    }
}
