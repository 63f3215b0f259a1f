/**
 * Configuration model package.
 *
 * <p>
 * Holds the values bound from {@code application.yml} (naming hierarchy, variable list, AWS
 * profiles) and their validation. Execution logic lives in {@code core} and {@code store}.
 * </p>
 */
package io.github.yok.ssmmigrator.config;
