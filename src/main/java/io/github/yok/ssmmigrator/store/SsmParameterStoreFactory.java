package io.github.yok.ssmmigrator.store;

import io.github.yok.ssmmigrator.config.AwsConfig;
import io.github.yok.ssmmigrator.exception.ConfigLoadException;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;

/**
 * Factory class that creates an AWS-backed {@link ParameterStore} for a credential profile.
 *
 * <p>
 * Credentials come from the named profile of the shared AWS config files. The region is taken
 * from {@code aws.region} when set, otherwise from the same profile. {@code aws.endpoint}, when
 * set, redirects the client (LocalStack, VPC endpoints).
 * </p>
 *
 * <p>
 * Credentials are resolved immediately, so a missing or broken profile fails here with
 * {@link ConfigLoadException} before any parameter is read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SsmParameterStoreFactory {

    // Profile names, region and endpoint override
    private final AwsConfig awsConfig;

    /**
     * Creates a store connected with the given profile.
     *
     * @param profile shared-config profile name
     * @return a store that must be closed by the caller
     * @throws ConfigLoadException if the credentials or the region cannot be resolved
     */
    public ParameterStore create(String profile) {
        try {
            ProfileCredentialsProvider credentials =
                    ProfileCredentialsProvider.builder().profileName(profile).build();
            credentials.resolveCredentials();

            Region region = resolveRegion(profile);
            SsmClientBuilder builder =
                    SsmClient.builder().credentialsProvider(credentials).region(region);
            if (StringUtils.isNotBlank(awsConfig.getEndpoint())) {
                builder.endpointOverride(URI.create(awsConfig.getEndpoint().trim()));
            }

            log.info("Parameter store client created. profile={}, region={}, endpoint={}", profile,
                    region, StringUtils.defaultIfBlank(awsConfig.getEndpoint(), "<default>"));
            return new SsmParameterStore(builder.build());

        } catch (SdkException | IllegalArgumentException e) {
            throw new ConfigLoadException("Unable to load SDK config for profile [" + profile
                    + "]: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the region: {@code aws.region} first, then the profile's own region.
     *
     * @param profile shared-config profile name
     * @return region
     */
    Region resolveRegion(String profile) {
        if (StringUtils.isNotBlank(awsConfig.getRegion())) {
            return Region.of(awsConfig.getRegion().trim());
        }
        return DefaultAwsRegionProviderChain.builder().profileName(profile).build().getRegion();
    }
}
