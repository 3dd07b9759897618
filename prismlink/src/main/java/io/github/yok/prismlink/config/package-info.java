/**
 * Configuration models.
 *
 * <p>
 * Tenant connection settings, paging sizes and the endpoint URLs derived from them, bound from
 * {@code application.yml} by Spring Boot.
 * </p>
 */
package io.github.yok.prismlink.config;
