package io.github.yok.ssmmigrator.core;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.github.yok.ssmmigrator.exception.DescriptionFetchException;
import io.github.yok.ssmmigrator.exception.DescriptionNotFoundException;
import io.github.yok.ssmmigrator.exception.DestinationWriteException;
import io.github.yok.ssmmigrator.exception.SourceFetchException;
import io.github.yok.ssmmigrator.exception.SourceNotFoundException;
import io.github.yok.ssmmigrator.store.NoSuchParameterException;
import io.github.yok.ssmmigrator.store.Parameter;
import io.github.yok.ssmmigrator.store.ParameterStore;
import io.github.yok.ssmmigrator.store.ParameterStoreException;
import io.github.yok.ssmmigrator.store.ParameterSummary;
import io.github.yok.ssmmigrator.util.MaskingLogUtil;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies parameters from their old names to their new names.
 *
 * <p>
 * <strong>Per pair:</strong>
 * </p>
 * <ol>
 * <li>Read the source value with decryption.</li>
 * <li>Read the source description (and KMS key id) from the metadata listing.</li>
 * <li>Write the destination with the same value, type and description.</li>
 * </ol>
 *
 * <p>
 * The destination type is always the source type, so a {@code SecureString} stays secure. The
 * first failure aborts the run: the remaining pairs are neither read nor written. Nothing is
 * retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ParameterCopier {

    // Remote store read from and written to
    private final ParameterStore parameterStore;

    // Passed through to every write
    private final boolean overwrite;

    /**
     * Constructs a copier.
     *
     * @param parameterStore store holding both hierarchies
     * @param overwrite whether an existing destination may be replaced
     */
    public ParameterCopier(ParameterStore parameterStore, boolean overwrite) {
        this.parameterStore =
                Preconditions.checkNotNull(parameterStore, "parameterStore must not be null");
        this.overwrite = overwrite;
    }

    /**
     * Copies every pair of the mapping, in order.
     *
     * @param mapping pairs to copy
     * @return number of copied parameters (always {@code mapping.size()} on return)
     * @throws io.github.yok.ssmmigrator.exception.MigrationException on the first failure
     */
    public int execute(NameMapping mapping) {
        log.info("Copying {} parameter(s). Environment [{}], overwrite={}", mapping.size(),
                mapping.getEnvironment().getLabel(), overwrite);
        int copied = 0;
        for (NamePair pair : mapping) {
            log.info("oldName: {} == newName: {}", pair.getOldName(), pair.getNewName());
            copy(pair.getOldName(), pair.getNewName());
            copied++;
        }
        log.info("Copy completed. {} parameter(s) copied", copied);
        return copied;
    }

    /**
     * Copies a single parameter.
     *
     * @param sourceName old name
     * @param destinationName new name
     * @throws SourceNotFoundException if the source does not exist
     * @throws SourceFetchException if the source cannot be read
     * @throws DescriptionNotFoundException if the metadata lookup finds nothing
     * @throws DescriptionFetchException if the metadata lookup fails
     * @throws DestinationWriteException if the store rejects the write
     */
    public void copy(String sourceName, String destinationName) {
        log.info("=====================");
        Parameter source = fetchSource(sourceName);
        ParameterSummary summary = fetchSummary(sourceName);
        String description = Strings.nullToEmpty(summary.getDescription());
        log.info("name: {}, value: {}, type: {}, description: {}", source.getName(),
                MaskingLogUtil.maskValue(source), source.getType().getWireName(), description);

        Parameter destination = new Parameter(destinationName, source.getValue(),
                source.getType(), description, summary.getKeyId());
        write(destination);
        log.info("Success copied parameter from {} to {}", sourceName, destinationName);
    }

    private Parameter fetchSource(String name) {
        try {
            return parameterStore.getByName(name, true);
        } catch (NoSuchParameterException e) {
            throw new SourceNotFoundException(name, e);
        } catch (ParameterStoreException e) {
            throw new SourceFetchException(name, e);
        }
    }

    private ParameterSummary fetchSummary(String name) {
        List<ParameterSummary> summaries;
        try {
            summaries = parameterStore.describeByName(name);
        } catch (ParameterStoreException e) {
            throw new DescriptionFetchException(name, e);
        }
        if (summaries.isEmpty()) {
            throw new DescriptionNotFoundException(name);
        }
        if (summaries.size() > 1) {
            log.warn("Metadata lookup for {} returned {} entries; using the first", name,
                    summaries.size());
        }
        return summaries.get(0);
    }

    private void write(Parameter destination) {
        try {
            parameterStore.put(destination, overwrite);
        } catch (ParameterStoreException e) {
            throw new DestinationWriteException(destination.getName(), e);
        }
    }
}
