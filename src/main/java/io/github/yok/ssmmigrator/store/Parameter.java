package io.github.yok.ssmmigrator.store;

import lombok.Data;
import lombok.ToString;

/**
 * A single parameter as read from or written to the store.
 *
 * <p>
 * {@code description} and {@code keyId} are not returned by a value lookup and stay {@code null}
 * until they are filled from the parameter metadata.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class Parameter {

    // Hierarchical path, e.g. /asset-accounting/staging/REDISCLOUD_URL
    private final String name;
    @ToString.Exclude
    private final String value;
    private final ParameterType type;
    private final String description;
    // KMS key of a SecureString; null for other types or when unknown
    private final String keyId;
}
