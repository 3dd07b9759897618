/**
 * Bearer token sessions.
 *
 * <p>
 * {@link io.github.yok.prismlink.auth.AuthProvider} hides how tokens are obtained and when they
 * are refreshed.
 * </p>
 */
package io.github.yok.prismlink.auth;
