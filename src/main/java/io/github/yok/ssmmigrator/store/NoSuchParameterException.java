package io.github.yok.ssmmigrator.store;

import lombok.Getter;

/**
 * Thrown when the store reports that the requested parameter does not exist.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class NoSuchParameterException extends ParameterStoreException {

    private static final long serialVersionUID = 1L;

    private final String parameterName;

    public NoSuchParameterException(String parameterName) {
        super("Parameter not found: " + parameterName);
        this.parameterName = parameterName;
    }

    public NoSuchParameterException(String parameterName, Throwable cause) {
        super("Parameter not found: " + parameterName, cause);
        this.parameterName = parameterName;
    }
}
