package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when reading the source parameter fails for any reason other than absence.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceFetchException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "get-source";

    public SourceFetchException(String parameterName, Throwable cause) {
        super(OPERATION, parameterName, "Failed to get source parameter details: " + parameterName,
                cause);
    }
}
