package io.github.yok.prismlink.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.util.MaskingLogUtil;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link AuthProvider} that exchanges the configured refresh token for an access token.
 *
 * <p>
 * The session is refreshed when none exists yet or when it is older than
 * {@code prism.token-max-age-seconds} (15 minutes by default). A failed exchange is logged and
 * leaves the provider without a session; the empty token it then returns makes the following REST
 * call fail with the service's own authorization error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class RefreshTokenAuthProvider implements AuthProvider {

    private final PrismConfig config;
    private final PrismEndpoints endpoints;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    // Current session; null until the first successful exchange
    private Session session;

    /**
     * Creates a provider using the system clock.
     *
     * @param config tenant settings (client credentials, refresh token, max token age)
     * @param endpoints endpoint resolver
     * @param httpClient JDK HTTP client
     * @param mapper JSON mapper
     */
    @Autowired
    public RefreshTokenAuthProvider(PrismConfig config, PrismEndpoints endpoints,
            HttpClient httpClient, ObjectMapper mapper) {
        this(config, endpoints, httpClient, mapper, Clock.systemUTC());
    }

    RefreshTokenAuthProvider(PrismConfig config, PrismEndpoints endpoints, HttpClient httpClient,
            ObjectMapper mapper, Clock clock) {
        this.config = config;
        this.endpoints = endpoints;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized String bearerToken() {
        Duration maxAge = Duration.ofSeconds(config.getTokenMaxAgeSeconds());
        if (session == null || session.isOlderThan(maxAge, clock)) {
            session = exchange().orElse(null);
        }
        return session == null ? "" : session.getBearerToken();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void invalidate() {
        session = null;
    }

    /**
     * Returns the current session without refreshing it.
     *
     * @return current session, empty if none has been established
     */
    public synchronized Optional<Session> currentSession() {
        return Optional.ofNullable(session);
    }

    private Optional<Session> exchange() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", config.getRefreshToken());
        form.put("client_id", config.getClientId());
        form.put("client_secret", config.getClientSecret());
        String body = form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(
                        e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        String url = endpoints.token();
        log.debug("post: {} body={}", url, MaskingLogUtil.maskForm(body));
        log.trace("Refreshing session of client_id={}, client_secret={}", config.getClientId(),
                MaskingLogUtil.maskText(config.getClientSecret()));

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body)).build();
        try {
            HttpResponse<String> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("Token exchange failed. status={}, body={}", response.statusCode(),
                        response.body());
                return Optional.empty();
            }
            JsonNode json = mapper.readTree(response.body());
            JsonNode token = json.get("access_token");
            if (token == null || !token.isTextual()) {
                log.error("Token exchange answered without an access_token.");
                return Optional.empty();
            }
            log.debug("Obtained bearer token.");
            return Optional.of(new Session(token.asText(), clock.instant()));
        } catch (IOException e) {
            log.error("Token exchange failed: {}", e.getMessage(), e);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Token exchange interrupted.");
            return Optional.empty();
        }
    }
}
