package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when the store rejects the write of the destination parameter.
 *
 * @author Yasuharu.Okawauchi
 */
public class DestinationWriteException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "put-destination";

    public DestinationWriteException(String parameterName, Throwable cause) {
        super(OPERATION, parameterName, "Failed to put destination parameter: " + parameterName,
                cause);
    }
}
