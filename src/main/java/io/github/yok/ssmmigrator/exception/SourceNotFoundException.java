package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when the source parameter does not exist in the store.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceNotFoundException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "get-source";

    public SourceNotFoundException(String parameterName, Throwable cause) {
        super(OPERATION, parameterName, "Source parameter not found: " + parameterName,
                cause);
    }
}
