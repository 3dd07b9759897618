/**
 * Root package of PrismLink.
 *
 * <p>
 * Provides a CLI/library to manage Prism tables and to load CSV data into them through buckets and
 * file containers.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.prismlink.config}: configuration models</li>
 * <li>{@code io.github.yok.prismlink.core}: lookups and the bucket load workflow</li>
 * <li>{@code io.github.yok.prismlink.schema}: schema loading and normalization</li>
 * <li>{@code io.github.yok.prismlink.http}: HTTP transport</li>
 * <li>{@code io.github.yok.prismlink.auth}: bearer token sessions</li>
 * </ul>
 */
package io.github.yok.prismlink;
