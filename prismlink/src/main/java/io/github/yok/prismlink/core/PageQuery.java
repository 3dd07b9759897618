package io.github.yok.prismlink.core;

import java.util.Map;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Criteria of a list or search request handled by {@link ResourcePager}.
 *
 * <p>
 * The combination of {@code name}, {@code searching} and {@code limit} selects the paging mode:
 * </p>
 * <ul>
 * <li>{@code name} set and {@code searching=false}: exact-name lookup, at most one item.</li>
 * <li>{@code searching=true}, or neither {@code name} nor {@code limit} set: full scan.</li>
 * <li>otherwise: a single page of {@code limit} items starting at {@code offset}.</li>
 * </ul>
 *
 * @param <T> resource type
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class PageQuery<T> {

    // Exact name, or the substring to look for when searching
    String name;

    boolean searching;

    Integer limit;

    Integer offset;

    // Extra query parameters sent with every page, e.g. type=full
    @Singular
    Map<String, String> params;

    // Additional client-side filter applied to scanned items, may be null
    Predicate<T> filter;

    /**
     * Returns a query that scans every item.
     *
     * @param <T> resource type
     * @return query
     */
    public static <T> PageQuery<T> all() {
        return PageQuery.<T>builder().build();
    }

    /**
     * Returns an exact-name lookup.
     *
     * @param <T> resource type
     * @param name exact API name
     * @return query
     */
    public static <T> PageQuery<T> exactName(String name) {
        return PageQuery.<T>builder().name(name).build();
    }

    /**
     * Returns a case-insensitive substring search over name and display name.
     *
     * @param <T> resource type
     * @param fragment substring to look for
     * @return query
     */
    public static <T> PageQuery<T> search(String fragment) {
        return PageQuery.<T>builder().name(fragment).searching(true).build();
    }

    boolean isExactName() {
        return name != null && !searching;
    }

    boolean isFullScan() {
        return !isExactName() && (searching || limit == null);
    }
}
