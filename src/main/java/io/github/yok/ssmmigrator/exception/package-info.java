/**
 * Failures that abort a migration run. Every type extends
 * {@link io.github.yok.ssmmigrator.exception.MigrationException}.
 */
package io.github.yok.ssmmigrator.exception;
