/**
 * Root package of the SSM parameter migrator.
 *
 * <p>
 * Provides a CLI that copies AWS Systems Manager parameters from
 * {@code /{namespace}/{environment}/{variable}} to
 * {@code /{namespace}/{subsystem}/{environment}/{variable}}, keeping value, type and description.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.ssmmigrator.config}: configuration models and validation</li>
 * <li>{@code io.github.yok.ssmmigrator.core}: name mapping and copy workflow</li>
 * <li>{@code io.github.yok.ssmmigrator.store}: parameter store access (AWS SDK)</li>
 * <li>{@code io.github.yok.ssmmigrator.exception}: failures that abort a run</li>
 * </ul>
 */
package io.github.yok.ssmmigrator;
