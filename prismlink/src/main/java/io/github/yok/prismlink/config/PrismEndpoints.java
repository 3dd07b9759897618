package io.github.yok.prismlink.config;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Composes the endpoint URLs of a Prism tenant from {@link PrismConfig}.
 *
 * <ul>
 * <li>token: {@code {base}/ccx/oauth2/{tenant}/token}</li>
 * <li>REST: {@code {base}/api/prismAnalytics/{version}/{tenant}}</li>
 * <li>WQL: {@code {base}/api/wql/v1/{tenant}}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class PrismEndpoints {

    private final PrismConfig config;

    /**
     * Returns the OAuth2 token endpoint.
     *
     * @return token endpoint URL
     * @throws IllegalStateException if {@code base-url} or {@code tenant-name} is not configured
     */
    public String token() {
        return base() + "/ccx/oauth2/" + tenant() + "/token";
    }

    /**
     * Returns the Prism REST endpoint; resource paths such as {@code /tables} are appended to it.
     *
     * @return REST endpoint URL
     * @throws IllegalStateException if {@code base-url} or {@code tenant-name} is not configured
     */
    public String prism() {
        return base() + "/api/prismAnalytics/" + config.getVersion() + "/" + tenant();
    }

    /**
     * Returns the WQL endpoint used for data source discovery.
     *
     * @return WQL endpoint URL
     * @throws IllegalStateException if {@code base-url} or {@code tenant-name} is not configured
     */
    public String wql() {
        return base() + "/api/wql/v1/" + tenant();
    }

    /**
     * Joins a resource path to the REST endpoint.
     *
     * @param path path beginning with {@code /}
     * @return absolute URL
     */
    public String prism(String path) {
        return prism() + path;
    }

    private String base() {
        String baseUrl = config.getBaseUrl();
        if (StringUtils.isBlank(baseUrl)) {
            throw new IllegalStateException("prism.base-url is not configured. "
                    + "Please set 'prism.base-url' in application.yml.");
        }
        return StringUtils.removeEnd(baseUrl.trim(), "/");
    }

    private String tenant() {
        if (StringUtils.isBlank(config.getTenantName())) {
            throw new IllegalStateException("prism.tenant-name is not configured. "
                    + "Please set 'prism.tenant-name' in application.yml.");
        }
        return config.getTenantName().trim();
    }
}
