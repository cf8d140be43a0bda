package com.luacomposer.core.error;

/**
 * Root of every fatal condition raised while composing a mission script.
 *
 * <p>All composer failures are unchecked. Each carries the path of the module
 * being processed and a source position when one is known; {@link #getLine()}
 * returns {@code 0} when no position applies.
 */
public class ComposerException extends RuntimeException {

    private final String modulePath;
    private final int line;
    private final int column;

    public ComposerException(String message) {
        this(message, null, 0, 0, null);
    }

    public ComposerException(String message, Throwable cause) {
        this(message, null, 0, 0, cause);
    }

    public ComposerException(String message, String modulePath, int line, int column) {
        this(message, modulePath, line, column, null);
    }

    public ComposerException(String message, String modulePath, int line, int column, Throwable cause) {
        super(message, cause);
        this.modulePath = modulePath;
        this.line = line;
        this.column = column;
    }

    /**
     * Returns the path of the module the failure belongs to.
     *
     * @return module path, or {@code null} when the failure is not tied to a module
     */
    public String getModulePath() {
        return modulePath;
    }

    /**
     * Returns the 1-based line of the failure.
     *
     * @return line number, or {@code 0} if unknown
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the 0-based column of the failure.
     *
     * @return column, or {@code 0} if unknown
     */
    public int getColumn() {
        return column;
    }
}
