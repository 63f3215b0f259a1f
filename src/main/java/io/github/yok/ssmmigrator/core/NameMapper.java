package io.github.yok.ssmmigrator.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.ssmmigrator.config.Environment;
import io.github.yok.ssmmigrator.config.MigrationConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the old-name to new-name mapping for an environment.
 *
 * <ul>
 * <li>Old name: {@code /{namespace}/{environment}/{variable}}</li>
 * <li>New name: {@code /{namespace}/{subsystem}/{environment}/{variable}}</li>
 * </ul>
 *
 * <p>
 * One pair per configured variable, in configuration order. Only the subsystem segment differs
 * between the two names. The configuration is expected to have passed
 * {@link io.github.yok.ssmmigrator.config.MigrationConfigValidator}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class NameMapper {

    private final MigrationConfig migrationConfig;

    /**
     * Constructs a mapper.
     *
     * @param migrationConfig namespace, subsystem and variable list
     */
    public NameMapper(MigrationConfig migrationConfig) {
        this.migrationConfig =
                Preconditions.checkNotNull(migrationConfig, "migrationConfig must not be null");
    }

    /**
     * Builds the mapping for the given environment.
     *
     * @param environment target environment
     * @return mapping with one pair per configured variable
     */
    public NameMapping map(Environment environment) {
        Preconditions.checkNotNull(environment, "environment must not be null");
        ImmutableList.Builder<NamePair> pairs = ImmutableList.builder();
        for (String variable : migrationConfig.getVariables()) {
            pairs.add(new NamePair(oldName(environment, variable), newName(environment, variable)));
        }
        NameMapping mapping = new NameMapping(environment, pairs.build());
        log.debug("Built name mapping for [{}]: {} pair(s)", environment.getLabel(),
                mapping.size());
        return mapping;
    }

    /**
     * Returns the old-hierarchy prefix of the environment, e.g.
     * {@code /asset-accounting/staging/}.
     *
     * @param environment target environment
     * @return prefix ending with {@code /}
     */
    public String oldPrefix(Environment environment) {
        return "/" + migrationConfig.getNamespace() + "/" + environment.getLabel() + "/";
    }

    /**
     * Returns the new-hierarchy prefix of the environment, e.g.
     * {@code /asset-accounting/serviceplatform/staging/}.
     *
     * @param environment target environment
     * @return prefix ending with {@code /}
     */
    public String newPrefix(Environment environment) {
        return "/" + migrationConfig.getNamespace() + "/" + migrationConfig.getSubsystem() + "/"
                + environment.getLabel() + "/";
    }

    String oldName(Environment environment, String variable) {
        return oldPrefix(environment) + variable;
    }

    String newName(Environment environment, String variable) {
        return newPrefix(environment) + variable;
    }
}
