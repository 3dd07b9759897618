package io.github.yok.prismlink.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Answer of a data change activity start request: the activity (201) or the service's error
 * body (400).
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ActivityStart {

    int status;

    // Response body, verbatim
    JsonNode body;

    /**
     * Returns whether the activity was started.
     *
     * @return {@code true} for a 201 answer
     */
    @JsonIgnore
    public boolean isStarted() {
        return status == 201;
    }

    /**
     * Returns the ID of the started activity.
     *
     * @return activity ID, or {@code null} if the activity was not started
     */
    @JsonIgnore
    public String getActivityId() {
        return isStarted() && body.hasNonNull("id") ? body.get("id").asText() : null;
    }
}
