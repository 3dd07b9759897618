/**
 * Typed Prism resources.
 *
 * <p>
 * Payloads are validated once when they are deserialized; unmodeled attributes are preserved on
 * each {@link io.github.yok.prismlink.model.PrismResource}.
 * </p>
 */
package io.github.yok.prismlink.model;
