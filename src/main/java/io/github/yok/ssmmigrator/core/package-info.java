/**
 * Core migration workflow.
 *
 * <ul>
 * <li>{@link io.github.yok.ssmmigrator.core.NameMapper}: old-name to new-name mapping</li>
 * <li>{@link io.github.yok.ssmmigrator.core.ParameterCopier}: read-then-write copy of each
 * pair</li>
 * <li>{@link io.github.yok.ssmmigrator.core.ParameterLister}: listing for inspection</li>
 * </ul>
 */
package io.github.yok.ssmmigrator.core;
