package com.luacomposer.core.error;

/**
 * Thrown in strict mode when a module touches the {@code os}, {@code io} or
 * {@code lfs} libraries, which are unavailable in a sanitized mission environment.
 */
public class StrictModeViolationException extends ComposerException {

    private final String usage;

    public StrictModeViolationException(String modulePath, int line, int column, String usage, String lineText) {
        super("Disallowed DCS API usage (" + usage + ") found in " + modulePath + " on line " + line + ": "
            + lineText, modulePath, line, column);
        this.usage = usage;
    }

    /**
     * Returns the offending access as written, e.g. {@code os.time}.
     *
     * @return the offending usage
     */
    public String getUsage() {
        return usage;
    }
}
