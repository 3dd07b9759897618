/**
 * Schema loading and normalization.
 */
package io.github.yok.prismlink.schema;
