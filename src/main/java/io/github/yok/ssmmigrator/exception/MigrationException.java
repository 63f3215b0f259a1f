package io.github.yok.ssmmigrator.exception;

import lombok.Getter;

/**
 * Base class of every failure that aborts a migration run.
 *
 * <p>
 * Carries the name of the failing operation and, when known, the parameter it was working on so
 * that the top-level handler can print a diagnostic naming both.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MigrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Operation label, e.g. "get-source" or "put-destination"
    private final String operation;
    // Parameter being processed; null for configuration failures
    private final String parameterName;

    protected MigrationException(String operation, String parameterName, String message,
            Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.parameterName = parameterName;
    }
}
