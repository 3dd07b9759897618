package io.github.yok.prismlink.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Answer of a bucket complete request.
 *
 * <p>
 * A 400 answer carries the row-level validation errors reported by the service. It is returned as
 * is, not raised.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class BucketCompletion {

    int status;

    // Response body, verbatim
    JsonNode body;

    /**
     * Returns whether the service rejected the bucket content.
     *
     * @return {@code true} for a 400 answer
     */
    @JsonIgnore
    public boolean isValidationError() {
        return status == 400;
    }
}
