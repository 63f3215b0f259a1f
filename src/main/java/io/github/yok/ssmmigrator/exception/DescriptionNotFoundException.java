package io.github.yok.ssmmigrator.exception;

/**
 * Thrown when the metadata lookup for the source parameter returns no match.
 *
 * @author Yasuharu.Okawauchi
 */
public class DescriptionNotFoundException extends MigrationException {

    private static final long serialVersionUID = 1L;

    public static final String OPERATION = "describe-source";

    public DescriptionNotFoundException(String parameterName) {
        super(OPERATION, parameterName, "Source parameter description not found: " + parameterName,
                null);
    }
}
