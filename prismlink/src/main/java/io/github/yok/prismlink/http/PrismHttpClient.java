package io.github.yok.prismlink.http;

import java.util.Map;

/**
 * Performs single HTTP requests against the Prism REST API.
 *
 * <p>
 * Implementations attach the authorization header and never throw for transport problems; they
 * return an {@link HttpResult} for every call. No retry or backoff happens at this level.
 * </p>
 */
public interface PrismHttpClient {

    /**
     * Issues a GET request.
     *
     * @param url absolute URL
     * @param params query parameters, appended URL-encoded; may be empty
     * @return request outcome
     */
    HttpResult get(String url, Map<String, String> params);

    /**
     * Issues a GET request without query parameters.
     *
     * @param url absolute URL
     * @return request outcome
     */
    default HttpResult get(String url) {
        return get(url, Map.of());
    }

    /**
     * Issues a POST request with a JSON body.
     *
     * @param url absolute URL
     * @param jsonBody JSON text, or {@code null} for an empty body
     * @return request outcome
     */
    HttpResult post(String url, String jsonBody);

    /**
     * Issues a multipart POST request carrying one file part named {@code file}.
     *
     * @param url absolute URL
     * @param file file part
     * @return request outcome
     */
    HttpResult postFile(String url, UploadFile file);

    /**
     * Issues a PUT request with a JSON body.
     *
     * @param url absolute URL
     * @param jsonBody JSON text
     * @return request outcome
     */
    HttpResult put(String url, String jsonBody);

    /**
     * Issues a PATCH request with a JSON body.
     *
     * @param url absolute URL
     * @param jsonBody JSON text
     * @return request outcome
     */
    HttpResult patch(String url, String jsonBody);
}
