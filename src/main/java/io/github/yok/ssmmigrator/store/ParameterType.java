package io.github.yok.ssmmigrator.store;

import lombok.Getter;

/**
 * Value types supported by the parameter store.
 *
 * <ul>
 * <li>STRING — plain text</li>
 * <li>SECURE_STRING — encrypted at rest, decrypted on read when requested</li>
 * <li>STRING_LIST — comma-separated list</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ParameterType {
    STRING("String"),
    SECURE_STRING("SecureString"),
    STRING_LIST("StringList");

    // Name used by the SSM API
    private final String wireName;

    ParameterType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Resolves a type from its SSM API name.
     *
     * @param wireName API name such as {@code SecureString}
     * @return matching type
     * @throws IllegalArgumentException if the name is not a supported type
     */
    public static ParameterType fromWireName(String wireName) {
        for (ParameterType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported parameter type: " + wireName);
    }
}
