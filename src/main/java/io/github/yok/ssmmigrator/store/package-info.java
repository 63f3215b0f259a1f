/**
 * Parameter store access package.
 *
 * <p>
 * Defines the {@link io.github.yok.ssmmigrator.store.ParameterStore} contract, its value types,
 * and the AWS Systems Manager implementation built on the AWS SDK for Java v2.
 * </p>
 */
package io.github.yok.ssmmigrator.store;
