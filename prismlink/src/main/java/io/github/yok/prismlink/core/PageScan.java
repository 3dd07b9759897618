package io.github.yok.prismlink.core;

import io.github.yok.prismlink.model.PagedResult;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * Outcome of a {@link ResourcePager} scan.
 *
 * <p>
 * Public callers see only {@link #toResult()}, which is always a list. The scan itself keeps the
 * number of pages fetched and the status that ended it early, if any.
 * </p>
 *
 * @param <T> resource type
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class PageScan<T> {

    // Status code meaning "no error"
    public static final int NO_ERROR = 0;

    // Matching items, in page order
    List<T> found;

    int pagesFetched;

    // Status of the response that interrupted the scan, or NO_ERROR
    int errorStatus;

    static <T> PageScan<T> completed(List<T> found, int pagesFetched) {
        return new PageScan<>(Collections.unmodifiableList(found), pagesFetched, NO_ERROR);
    }

    static <T> PageScan<T> interrupted(List<T> found, int pagesFetched, int status) {
        return new PageScan<>(Collections.unmodifiableList(found), pagesFetched, status);
    }

    /**
     * Returns whether every requested page was fetched successfully.
     *
     * @return {@code false} if a non-success response ended the scan
     */
    public boolean isComplete() {
        return errorStatus == NO_ERROR;
    }

    /**
     * Returns the accumulated items as a paged result whose total is the number of items.
     *
     * @return paged result
     */
    public PagedResult<T> toResult() {
        return new PagedResult<>(found);
    }
}
