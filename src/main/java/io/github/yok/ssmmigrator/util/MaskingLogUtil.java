package io.github.yok.ssmmigrator.util;

import io.github.yok.ssmmigrator.store.Parameter;
import io.github.yok.ssmmigrator.store.ParameterType;
import lombok.Generated;

/**
 * Utility for keeping secure parameter values out of the log.
 *
 * <p>
 * {@code SecureString} values are always rendered as {@code ***}. Plain and list values are shown
 * as-is, which keeps the progress trace useful for the common non-secret settings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    private static final String MASK = "***";

    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null}/empty when input is {@code null}/empty
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return MASK;
    }

    /**
     * Renders the value of a parameter for logging.
     *
     * @param parameter parameter
     * @return the value, masked when the parameter is a secure string; {@code "<null>"} when the
     *         parameter is {@code null}
     */
    public static String maskValue(Parameter parameter) {
        if (parameter == null) {
            return "<null>";
        }
        if (parameter.getType() == ParameterType.SECURE_STRING) {
            return maskText(parameter.getValue());
        }
        return parameter.getValue();
    }
}
