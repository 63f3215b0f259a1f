package io.github.yok.ssmmigrator.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumerates the environments whose parameters can be migrated.
 *
 * <p>
 * The label is the path segment that appears in parameter names, e.g. {@code staging} in
 * {@code /asset-accounting/staging/REDISCLOUD_URL}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum Environment {
    STAGING("staging"),
    BETA("beta"),
    PRODUCTION("production");

    private final String label;

    Environment(String label) {
        this.label = label;
    }

    /**
     * Resolves an environment from its label (case-insensitive, surrounding blanks ignored).
     *
     * @param label environment label
     * @return matching environment
     * @throws IllegalArgumentException if the label is blank or not one of the known labels
     */
    public static Environment fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("environment is required.");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Environment environment : values()) {
            if (environment.label.equals(normalized)) {
                return environment;
            }
        }
        throw new IllegalArgumentException("Unknown environment: " + label + " (expected one of "
                + Arrays.stream(values()).map(Environment::getLabel)
                        .collect(Collectors.joining(", "))
                + ")");
    }
}
