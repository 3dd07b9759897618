package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A list result: {@code total} items in {@code data}.
 *
 * <p>
 * {@code total} is always {@code data.size()}; it is computed here and never taken from a server
 * count.
 * </p>
 *
 * @param <T> item type
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"total", "data"})
public class PagedResult<T> {

    private final int total;

    private final List<T> data;

    /**
     * Creates a result over the given items.
     *
     * @param data items, in order; {@code null} is treated as empty
     */
    public PagedResult(List<T> data) {
        this.data = data == null ? Collections.emptyList() : Collections.unmodifiableList(data);
        this.total = this.data.size();
    }

    /**
     * Returns an empty result.
     *
     * @param <T> item type
     * @return result with {@code total == 0}
     */
    public static <T> PagedResult<T> empty() {
        return new PagedResult<>(Collections.emptyList());
    }

    /**
     * Returns whether no item was found.
     *
     * @return {@code true} if {@code total == 0}
     */
    @JsonIgnore
    public boolean isEmpty() {
        return total == 0;
    }

    /**
     * Returns the first item, as the single answer of an exact-name lookup.
     *
     * @return first item, or {@code null} when empty
     */
    public T first() {
        return data.isEmpty() ? null : data.get(0);
    }
}
