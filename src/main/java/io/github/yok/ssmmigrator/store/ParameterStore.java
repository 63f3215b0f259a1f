package io.github.yok.ssmmigrator.store;

import java.util.List;

/**
 * Narrow view of a remote parameter store.
 *
 * <p>
 * Exposes only the four operations the migration needs, so that the copy logic can run against
 * AWS Systems Manager or an in-memory store alike. Implementations throw
 * {@link NoSuchParameterException} for a missing parameter and {@link ParameterStoreException} for
 * every other failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ParameterStore extends AutoCloseable {

    /**
     * Returns the metadata of every parameter in the store, across all pages.
     *
     * @return parameter summaries
     * @throws ParameterStoreException on transport or authorization failure
     */
    List<ParameterSummary> listAll();

    /**
     * Returns the parameter with the given name.
     *
     * @param name exact parameter name
     * @param decrypt whether secure values are returned decrypted
     * @return the parameter (description and key id are not populated)
     * @throws NoSuchParameterException if the store has no such parameter
     * @throws ParameterStoreException on any other failure
     */
    Parameter getByName(String name, boolean decrypt);

    /**
     * Returns the metadata of the parameters whose name equals {@code name}. Zero or one entry is
     * expected.
     *
     * @param name exact parameter name
     * @return matching summaries, possibly empty
     * @throws ParameterStoreException on transport or authorization failure
     */
    List<ParameterSummary> describeByName(String name);

    /**
     * Writes a parameter.
     *
     * @param parameter name, value, type, description and optional key id to write
     * @param overwrite whether an existing parameter with the same name may be replaced
     * @throws ParameterStoreException if the store rejects the write
     */
    void put(Parameter parameter, boolean overwrite);

    /**
     * Releases resources held by the store client. Does nothing by default.
     */
    @Override
    default void close() {}
}
