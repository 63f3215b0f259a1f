package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when the configuration or the AWS credentials cannot be loaded. Raised before any
 * parameter work begins.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigLoadException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "load-config";

    public ConfigLoadException(String message, Throwable cause) {
        super(OPERATION, null, message, cause);
    }
}
