/**
 * HTTP transport boundary.
 *
 * <p>
 * {@link io.github.yok.prismlink.http.PrismHttpClient} performs exactly one request per call and
 * always answers with an {@link io.github.yok.prismlink.http.HttpResult}; the core never handles
 * TLS, pooling or authorization headers itself.
 * </p>
 */
package io.github.yok.prismlink.http;
