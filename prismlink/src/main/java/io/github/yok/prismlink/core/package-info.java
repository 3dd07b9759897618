/**
 * Lookups and the bucket load workflow.
 *
 * <p>
 * {@link io.github.yok.prismlink.core.ResourcePager} implements exact-name, single-page and
 * full-scan lookups for every collection. Writes go through
 * {@link io.github.yok.prismlink.core.BucketManager},
 * {@link io.github.yok.prismlink.core.FileStager} and
 * {@link io.github.yok.prismlink.core.LoadOrchestrator}.
 * </p>
 */
package io.github.yok.prismlink.core;
