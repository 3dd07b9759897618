package io.github.yok.prismlink.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.yok.prismlink.model.Bucket;
import lombok.Value;

/**
 * Outcome of a {@link LoadOrchestrator} load or truncate.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class LoadResult {

    // Bucket created for the load
    Bucket bucket;

    // Staging receipts
    StagingResult files;

    // Completion answer; null when no file was staged and the bucket was left New
    BucketCompletion completion;

    /**
     * Returns whether the bucket was completed.
     *
     * @return {@code true} if the complete request was sent
     */
    @JsonIgnore
    public boolean isCompleted() {
        return completion != null;
    }
}
