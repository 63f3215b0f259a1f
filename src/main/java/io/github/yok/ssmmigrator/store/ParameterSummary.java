package io.github.yok.ssmmigrator.store;

import java.time.Instant;
import lombok.Data;

/**
 * Metadata of a parameter as returned by the describe/list operations. Never carries the value.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ParameterSummary {

    private final String name;
    private final ParameterType type;
    private final String description;
    private final String keyId;
    private final Instant lastModified;
    private final Long version;
}
