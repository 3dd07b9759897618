package io.github.yok.prismlink.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the connection settings of the Prism tenant.
 *
 * <pre>
 * prism:
 *   base-url: https://wd2-impl-services1.workday.com
 *   tenant-name: acme_tenant
 *   client-id: ${PRISM_CLIENT_ID}
 *   client-secret: ${PRISM_CLIENT_SECRET}
 *   refresh-token: ${PRISM_REFRESH_TOKEN}
 *   version: v3
 * </pre>
 *
 * <p>
 * Endpoint URLs are derived from these values by {@link PrismEndpoints}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "prism")
@Data
public class PrismConfig {

    // Scheme and host of the tenant's services (no trailing path)
    private String baseUrl;

    // Tenant name as it appears in REST URLs
    private String tenantName;

    // Registered API client
    private String clientId;
    @ToString.Exclude
    private String clientSecret;

    // Refresh token of the integration user
    @ToString.Exclude
    private String refreshToken;

    // Prism REST API version
    private String version = "v3";

    // Sessions older than this are refreshed before the next call
    private long tokenMaxAgeSeconds = 900;

    // Autogenerated bucket names are this prefix plus a random hex suffix
    private String bucketNamePrefix = "prismlink_";

    // Connect timeout handed to the HTTP client
    private long connectTimeoutSeconds = 30;
}
