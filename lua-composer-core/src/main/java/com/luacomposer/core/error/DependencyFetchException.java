package com.luacomposer.core.error;

/**
 * Thrown when an external dependency cannot be fetched from its declared source.
 */
public class DependencyFetchException extends ComposerException {

    private final String dependencyName;

    public DependencyFetchException(String dependencyName, String message) {
        this(dependencyName, message, null);
    }

    public DependencyFetchException(String dependencyName, String message, Throwable cause) {
        super("Failed to fetch dependency '" + dependencyName + "': " + message, cause);
        this.dependencyName = dependencyName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
