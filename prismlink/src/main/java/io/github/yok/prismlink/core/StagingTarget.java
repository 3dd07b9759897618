package io.github.yok.prismlink.core;

import com.google.common.base.Preconditions;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Destination of {@link FileStager#stage}: a bucket, or a file container that may not exist yet.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class StagingTarget {

    /**
     * Kind of staging area.
     */
    public enum Kind {
        BUCKET("/buckets/"), FILE_CONTAINER("/fileContainers/");

        private final String path;

        Kind(String path) {
            this.path = path;
        }

        String filesPath(String id) {
            return path + id + "/files";
        }
    }

    Kind kind;

    // Null for a file container created on first upload
    String id;

    /**
     * Targets an existing bucket.
     *
     * @param bucketId bucket ID
     * @return target
     */
    public static StagingTarget bucket(String bucketId) {
        Preconditions.checkArgument(StringUtils.isNotBlank(bucketId), "bucketId is required");
        return new StagingTarget(Kind.BUCKET, bucketId);
    }

    /**
     * Targets a file container.
     *
     * @param containerId container ID, or null to create one on the first upload
     * @return target
     */
    public static StagingTarget fileContainer(String containerId) {
        return new StagingTarget(Kind.FILE_CONTAINER, StringUtils.trimToNull(containerId));
    }
}
