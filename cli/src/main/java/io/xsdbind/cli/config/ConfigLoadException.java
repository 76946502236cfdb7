package io.xsdbind.cli.config;

/**
 * Thrown when the CLI configuration cannot be loaded: missing file, invalid YAML or an
 * unrecognized value. The message is printed as-is on startup failure.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
