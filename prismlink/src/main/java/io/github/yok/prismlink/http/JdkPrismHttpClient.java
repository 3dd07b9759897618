package io.github.yok.prismlink.http;

import io.github.yok.prismlink.auth.AuthProvider;
import io.github.yok.prismlink.util.MaskingLogUtil;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * {@link PrismHttpClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Every request carries {@code Authorization: Bearer <token>} obtained from the
 * {@link AuthProvider}. A {@code 401} answer invalidates the session so the next request
 * refreshes it; the failed request itself is not retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdkPrismHttpClient implements PrismHttpClient {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private final HttpClient httpClient;
    private final AuthProvider authProvider;

    /**
     * {@inheritDoc}
     */
    @Override
    public HttpResult get(String url, Map<String, String> params) {
        String target = withQuery(url, params);
        return send("get", HttpRequest.newBuilder(URI.create(target)).GET());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public HttpResult post(String url, String jsonBody) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url));
        if (jsonBody == null) {
            builder.POST(BodyPublishers.noBody());
        } else {
            builder.header(CONTENT_TYPE, APPLICATION_JSON).POST(BodyPublishers.ofString(jsonBody));
        }
        return send("post", builder);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public HttpResult postFile(String url, UploadFile file) {
        String boundary = "prismlink-" + UUID.randomUUID().toString().replace("-", "");
        BodyPublisher content;
        try {
            content = file.isStreamed() ? BodyPublishers.ofFile(file.getPath())
                    : BodyPublishers.ofByteArray(file.getContent());
        } catch (FileNotFoundException e) {
            log.error("Upload source not found: {}", file.getPath());
            return HttpResult.transportFailure("file not found: " + file.getPath());
        }
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\""
                + quotedFileName(file.getFileName()) + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";
        BodyPublisher body = BodyPublishers.concat(
                BodyPublishers.ofString(head, StandardCharsets.UTF_8), content,
                BodyPublishers.ofString(tail, StandardCharsets.UTF_8));
        return send("post", HttpRequest.newBuilder(URI.create(url))
                .header(CONTENT_TYPE, "multipart/form-data; boundary=" + boundary).POST(body));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public HttpResult put(String url, String jsonBody) {
        return send("put", HttpRequest.newBuilder(URI.create(url))
                .header(CONTENT_TYPE, APPLICATION_JSON).PUT(BodyPublishers.ofString(jsonBody)));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public HttpResult patch(String url, String jsonBody) {
        return send("patch", HttpRequest.newBuilder(URI.create(url))
                .header(CONTENT_TYPE, APPLICATION_JSON)
                .method("PATCH", BodyPublishers.ofString(jsonBody)));
    }

    /**
     * Percent-encodes the characters that would break a quoted {@code filename} parameter.
     *
     * @param fileName raw file name
     * @return file name safe inside the part header quotes
     */
    static String quotedFileName(String fileName) {
        return StringUtils.replaceEach(fileName, new String[] {"\"", "\r", "\n"},
                new String[] {"%22", "%0D", "%0A"});
    }

    private HttpResult send(String method, HttpRequest.Builder builder) {
        String authorization = "Bearer " + authProvider.bearerToken();
        builder.header("Authorization", authorization);
        HttpRequest request = builder.build();
        log.debug("{}: {}", method, request.uri());
        log.trace("Authorization: {}", MaskingLogUtil.maskAuthorization(authorization));

        long started = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("{} {} failed: {}", method, request.uri(), e.getMessage());
            return HttpResult.transportFailure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("{} {} interrupted", method, request.uri());
            return HttpResult.transportFailure("interrupted");
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        log.debug("{}: status={}, elapsed={}ms", method, response.statusCode(), elapsedMs);

        int status = response.statusCode();
        if (status == 401) {
            authProvider.invalidate();
        }
        if (status > 299) {
            log.error("Invalid HTTP status: {} {}", status, request.uri());
            log.error("Text: {}", response.body());
        }
        return new HttpResult(status, response.body(), reasonPhrase(status));
    }

    static String withQuery(String url, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return url;
        }
        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    static String reasonPhrase(int status) {
        switch (status) {
            case 200:
                return "OK";
            case 201:
                return "Created";
            case 400:
                return "Bad Request";
            case 401:
                return "Unauthorized";
            case 403:
                return "Forbidden";
            case 404:
                return "Not Found";
            case 500:
                return "Internal Server Error";
            default:
                return "HTTP " + status;
        }
    }
}
