package io.github.yok.prismlink.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared infrastructure beans: the JSON mapper and the JDK HTTP client.
 *
 * @author Yasuharu.Okawauchi
 */
@Configuration
public class PrismClientConfiguration {

    /**
     * Creates the mapper used for every Prism payload.
     *
     * <p>
     * Unknown attributes are ignored on read; absent optional attributes are omitted on write.
     * </p>
     *
     * @return configured mapper
     */
    @Bean
    public ObjectMapper prismObjectMapper() {
        return newObjectMapper();
    }

    /**
     * Creates the JDK HTTP client shared by the REST client and the token exchange.
     *
     * @param config tenant settings
     * @return HTTP client
     */
    @Bean
    public HttpClient prismHttpClient(PrismConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Creates a mapper with the Prism settings, for use outside the Spring container.
     *
     * @return configured mapper
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
