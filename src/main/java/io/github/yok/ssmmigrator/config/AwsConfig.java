package io.github.yok.ssmmigrator.config;

import com.google.common.base.Preconditions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code aws} section in {@code application.yml}.
 *
 * <p>
 * The credential profile is chosen from the environment: {@link Environment#PRODUCTION} uses
 * {@code production-profile}, every other environment uses {@code staging-profile}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "aws")
@Data
public class AwsConfig {

    // Shared-config profile used for staging and beta
    private String stagingProfile = "aa_stg";
    // Shared-config profile used for production
    private String productionProfile = "aa_prod";
    // Region override; when blank the region of the selected profile is used
    private String region;
    // Endpoint override (e.g. http://localhost:4566 for LocalStack)
    private String endpoint;

    /**
     * Returns the credential profile to use for the given environment.
     *
     * @param environment target environment
     * @return profile name
     * @throws NullPointerException if {@code environment} is {@code null}
     */
    public String resolveProfile(Environment environment) {
        Preconditions.checkNotNull(environment, "environment must not be null");
        return environment == Environment.PRODUCTION ? productionProfile : stagingProfile;
    }
}
