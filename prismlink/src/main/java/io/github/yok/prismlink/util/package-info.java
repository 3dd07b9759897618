/**
 * Utility package for PrismLink.
 *
 * <p>
 * Provides the exception model, CLI error reporting, secret masking for logs, log-path helpers and
 * wire constants shared across packages.
 * </p>
 */
package io.github.yok.prismlink.util;
