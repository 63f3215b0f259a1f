package io.github.yok.ssmmigrator.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code migration} section in {@code application.yml}.
 *
 * <pre>
 * migration:
 *   namespace: asset-accounting
 *   subsystem: serviceplatform
 *   environment: staging
 *   overwrite: false
 *   variables:
 *     - REDISCLOUD_URL
 * </pre>
 *
 * <p>
 * Old parameter names follow {@code /{namespace}/{environment}/{variable}}, new names follow
 * {@code /{namespace}/{subsystem}/{environment}/{variable}}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "migration")
@Getter
@Setter
@NoArgsConstructor
public class MigrationConfig {

    /**
     * Top-level path segment shared by the old and new hierarchy.
     */
    private String namespace = "asset-accounting";

    /**
     * Path segment inserted after the namespace in the new hierarchy.
     */
    private String subsystem = "serviceplatform";

    /**
     * Environment label used when {@code --env} is not given on the command line.
     */
    private String environment = "staging";

    /**
     * When {@code true}, an existing destination parameter is replaced. Defaults to {@code false},
     * so a second run over already migrated names fails on the first write.
     */
    private boolean overwrite = false;

    /**
     * Ordered list of logical variable identifiers to migrate.
     */
    private List<String> variables = ImmutableList.of("REDISCLOUD_URL");
}
