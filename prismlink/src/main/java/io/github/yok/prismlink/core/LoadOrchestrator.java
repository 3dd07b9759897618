package io.github.yok.prismlink.core;

import io.github.yok.prismlink.model.Bucket;
import io.github.yok.prismlink.model.BucketOperation;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads files into a table through a new bucket: create, stage, complete.
 *
 * <p>
 * Each call creates its own bucket, so a load followed by a truncate completes two distinct
 * buckets. Truncation is a {@code TruncateAndInsert} load of one empty payload.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadOrchestrator {

    private final BucketManager buckets;
    private final FileStager stager;

    /**
     * Loads files into a table.
     *
     * @param target target table
     * @param files files to upload, or {@code null} for the empty payload
     * @param operation bucket operation
     * @return the bucket, receipts and completion answer; the completion is {@code null} when no
     *         file was staged
     * @throws io.github.yok.prismlink.util.PrismException if the bucket cannot be created or
     *         completed
     */
    public LoadResult load(TableTarget target, List<Path> files, BucketOperation operation) {
        return load(BucketRequest.builder().target(target).operation(operation).build(), files);
    }

    /**
     * Loads files through a bucket created from a full request, e.g. with a schema file.
     *
     * @param request bucket request
     * @param files files to upload, or {@code null} for the empty payload
     * @return the bucket, receipts and completion answer
     * @throws io.github.yok.prismlink.util.PrismException if the bucket cannot be created or
     *         completed
     */
    public LoadResult load(BucketRequest request, List<Path> files) {
        Bucket bucket = buckets.create(request);
        StagingResult staged = stager.stage(StagingTarget.bucket(bucket.getId()), files);
        if (staged.isEmpty()) {
            log.warn("No file staged to bucket {}; the bucket is left incomplete.", bucket.getId());
            return new LoadResult(bucket, staged, null);
        }
        BucketCompletion completion = buckets.complete(bucket.getId());
        if (completion.isValidationError()) {
            log.warn("Bucket {} was rejected by the service: {}", bucket.getId(),
                    completion.getBody());
        } else {
            log.info("Loaded {} file(s) into table {} through bucket {}", staged.getTotal(),
                    bucket.getTargetDataset() == null ? "?" : bucket.getTargetDataset().getId(),
                    bucket.getId());
        }
        return new LoadResult(bucket, staged, completion);
    }

    /**
     * Deletes every row of a table.
     *
     * @param target target table
     * @return the bucket, the empty-payload receipt and the completion answer
     * @throws io.github.yok.prismlink.util.PrismException if the bucket cannot be created or
     *         completed
     */
    public LoadResult truncate(TableTarget target) {
        return load(target, null, BucketOperation.TRUNCATE_AND_INSERT);
    }
}
