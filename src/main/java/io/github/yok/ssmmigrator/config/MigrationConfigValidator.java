package io.github.yok.ssmmigrator.config;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates {@link MigrationConfig} and normalizes its values before any parameter is touched.
 *
 * <p>
 * Path segments are trimmed and must not be blank or contain {@code /}. The variable list must
 * not be empty and must not contain duplicates, since each variable yields exactly one old/new name
 * pair.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MigrationConfigValidator {

    /**
     * Validates the configuration and writes the trimmed values back.
     *
     * @param config migration configuration
     * @throws IllegalArgumentException if a value is missing or malformed
     */
    public void validateAndNormalize(MigrationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Migration configuration is required.");
        }
        config.setNamespace(requireSegment(config.getNamespace(), "migration.namespace"));
        config.setSubsystem(requireSegment(config.getSubsystem(), "migration.subsystem"));
        normalizeVariables(config);
    }

    /**
     * Trims every variable identifier and rejects blanks, slashes and duplicates.
     *
     * @param config migration configuration
     */
    private void normalizeVariables(MigrationConfig config) {
        if (config.getVariables() == null || config.getVariables().isEmpty()) {
            throw new IllegalArgumentException("migration.variables must not be empty.");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String raw : config.getVariables()) {
            String variable = requireSegment(raw, "migration.variables");
            if (!normalized.add(variable)) {
                throw new IllegalArgumentException(
                        "migration.variables contains a duplicate: " + variable);
            }
        }
        config.setVariables(ImmutableList.copyOf(normalized));
    }

    /**
     * Returns the trimmed segment after checking it is usable inside a parameter path.
     *
     * @param value raw value
     * @param key property key used in the error message
     * @return trimmed value
     */
    private String requireSegment(String value, String key) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(key + " must not contain blank values.");
        }
        String trimmed = value.trim();
        if (trimmed.contains("/")) {
            throw new IllegalArgumentException(key + " must not contain '/': " + trimmed);
        }
        return trimmed;
    }
}
