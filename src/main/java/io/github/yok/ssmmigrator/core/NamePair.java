package io.github.yok.ssmmigrator.core;

import lombok.Data;

/**
 * One old-name to new-name correspondence.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class NamePair {

    // e.g. /asset-accounting/staging/REDISCLOUD_URL
    private final String oldName;
    // e.g. /asset-accounting/serviceplatform/staging/REDISCLOUD_URL
    private final String newName;
}
