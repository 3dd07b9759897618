package io.github.yok.prismlink.http;

import lombok.Value;

/**
 * Outcome of one HTTP request: status code, body text and reason.
 *
 * <p>
 * Transport problems (connection refused, I/O error, interruption) are reported as a result with
 * status {@link #TRANSPORT_FAILURE} instead of an exception.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class HttpResult {

    /**
     * Synthetic status used when no HTTP response was received.
     */
    public static final int TRANSPORT_FAILURE = 600;

    int statusCode;

    String body;

    String reason;

    /**
     * Creates a synthetic result for a request that never produced a response.
     *
     * @param reason description of the transport problem
     * @return result with status {@link #TRANSPORT_FAILURE}
     */
    public static HttpResult transportFailure(String reason) {
        return new HttpResult(TRANSPORT_FAILURE, reason, reason);
    }

    /**
     * Returns whether the status matches the expected one.
     *
     * @param expected expected status code
     * @return {@code true} if equal
     */
    public boolean is(int expected) {
        return statusCode == expected;
    }

    /**
     * Returns whether the status is in the 2xx range.
     *
     * @return {@code true} for a success status
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
