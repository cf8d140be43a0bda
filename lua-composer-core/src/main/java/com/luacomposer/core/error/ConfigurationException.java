package com.luacomposer.core.error;

import java.util.List;

/**
 * Thrown when the build inputs are unusable: a missing or misplaced role file,
 * an unreadable configuration file, an invalid dependency declaration or two
 * files that map to the same module identity.
 *
 * <p>Validation collects every problem it finds before failing, so one
 * exception may describe several of them; see {@link #getProblems()}.
 */
public class ConfigurationException extends ComposerException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String format(List<String> problems) {
        if (problems.size() == 1) {
            return problems.get(0);
        }
        return "Invalid configuration (" + problems.size() + " problems):\n  - "
            + String.join("\n  - ", problems);
    }
}
