package io.github.yok.ssmmigrator.store;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.DescribeParametersRequest;
import software.amazon.awssdk.services.ssm.model.DescribeParametersResponse;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.ParameterMetadata;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterStringFilter;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;
import software.amazon.awssdk.services.ssm.model.PutParameterResponse;

/**
 * {@link ParameterStore} backed by AWS Systems Manager Parameter Store.
 *
 * <p>
 * SDK failures are translated at this boundary: {@link ParameterNotFoundException} becomes
 * {@link NoSuchParameterException}, every other {@link SdkException} becomes
 * {@link ParameterStoreException}. Listing follows {@code NextToken} until the last page, because
 * a filtered {@code DescribeParameters} call may return empty pages before the match.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SsmParameterStore implements ParameterStore {

    // DescribeParameters filter key / option for an exact name match
    static final String NAME_FILTER_KEY = "Name";
    static final String EQUALS_OPTION = "Equals";

    private final SsmClient ssmClient;

    /**
     * Constructs a store over an SDK client. The store owns the client and closes it.
     *
     * @param ssmClient SSM client
     */
    public SsmParameterStore(SsmClient ssmClient) {
        this.ssmClient = Preconditions.checkNotNull(ssmClient, "ssmClient must not be null");
    }

    @Override
    public List<ParameterSummary> listAll() {
        List<ParameterSummary> summaries = describe(DescribeParametersRequest.builder().build());
        log.debug("Listed {} parameter(s)", summaries.size());
        return summaries;
    }

    @Override
    public Parameter getByName(String name, boolean decrypt) {
        log.debug("Getting parameter details for: {}", name);
        GetParameterResponse response;
        try {
            response = ssmClient.getParameter(
                    GetParameterRequest.builder().name(name).withDecryption(decrypt).build());
        } catch (ParameterNotFoundException e) {
            throw new NoSuchParameterException(name, e);
        } catch (SdkException e) {
            throw new ParameterStoreException("Failed to get parameter: " + name, e);
        }
        software.amazon.awssdk.services.ssm.model.Parameter found = response.parameter();
        return new Parameter(found.name(), found.value(), toType(found.typeAsString()), null,
                null);
    }

    @Override
    public List<ParameterSummary> describeByName(String name) {
        ParameterStringFilter filter = ParameterStringFilter.builder().key(NAME_FILTER_KEY)
                .option(EQUALS_OPTION).values(name).build();
        return describe(DescribeParametersRequest.builder().parameterFilters(filter).build());
    }

    @Override
    public void put(Parameter parameter, boolean overwrite) {
        PutParameterRequest.Builder builder = PutParameterRequest.builder()
                .name(parameter.getName())
                .value(parameter.getValue())
                .type(parameter.getType().getWireName())
                .overwrite(overwrite);
        if (StringUtils.isNotEmpty(parameter.getDescription())) {
            builder.description(parameter.getDescription());
        }
        if (parameter.getType() == ParameterType.SECURE_STRING
                && StringUtils.isNotBlank(parameter.getKeyId())) {
            builder.keyId(parameter.getKeyId());
        }
        try {
            PutParameterResponse response = ssmClient.putParameter(builder.build());
            log.debug("Put parameter {} (version={})", parameter.getName(), response.version());
        } catch (SdkException e) {
            throw new ParameterStoreException("Failed to put parameter: " + parameter.getName(), e);
        }
    }

    @Override
    public void close() {
        ssmClient.close();
    }

    /**
     * Runs {@code DescribeParameters} over every page of the given request.
     *
     * @param request first-page request
     * @return summaries of all pages in API order
     */
    private List<ParameterSummary> describe(DescribeParametersRequest request) {
        List<ParameterSummary> summaries = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                DescribeParametersResponse page = ssmClient
                        .describeParameters(request.toBuilder().nextToken(nextToken).build());
                for (ParameterMetadata metadata : page.parameters()) {
                    summaries.add(toSummary(metadata));
                }
                nextToken = page.nextToken();
            } while (StringUtils.isNotEmpty(nextToken));
        } catch (SdkException e) {
            throw new ParameterStoreException("Failed to describe parameters", e);
        }
        return summaries;
    }

    private ParameterSummary toSummary(ParameterMetadata metadata) {
        return new ParameterSummary(metadata.name(), toType(metadata.typeAsString()),
                metadata.description(), metadata.keyId(), metadata.lastModifiedDate(),
                metadata.version());
    }

    private ParameterType toType(String wireName) {
        try {
            return ParameterType.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new ParameterStoreException(e.getMessage(), e);
        }
    }
}
