package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when the metadata lookup for the source parameter fails.
 *
 * @author Yasuharu.Okawauchi
 */
public class DescriptionFetchException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "describe-source";

    public DescriptionFetchException(String parameterName, Throwable cause) {
        super(OPERATION, parameterName,
                "Failed to get source parameter description: " + parameterName, cause);
    }
}
