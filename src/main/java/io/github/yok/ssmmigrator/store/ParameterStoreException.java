package io.github.yok.ssmmigrator.store;

/**
 * Thrown when a parameter store operation fails (transport, authorization, rejected write).
 *
 * @author Yasuharu.Okawauchi
 */
public class ParameterStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParameterStoreException(String message) {
        super(message);
    }

    public ParameterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
