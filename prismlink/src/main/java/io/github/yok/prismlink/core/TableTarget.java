package io.github.yok.prismlink.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Table addressed by ID or by exact API name. An ID takes precedence when both are set.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TableTarget {

    private static final TableTarget NONE = new TableTarget(null, null);

    String id;

    String name;

    /**
     * Addresses a table by ID.
     *
     * @param id table ID
     * @return target
     */
    public static TableTarget byId(String id) {
        return new TableTarget(id, null);
    }

    /**
     * Addresses a table by API name.
     *
     * @param name API name
     * @return target
     */
    public static TableTarget byName(String name) {
        return new TableTarget(null, name);
    }

    /**
     * Addresses a table by whichever of ID and name is set.
     *
     * @param id table ID, may be null
     * @param name API name, may be null
     * @return target
     */
    public static TableTarget of(String id, String name) {
        return new TableTarget(id, name);
    }

    /**
     * Returns a target that names no table; the schema must then carry the table ID.
     *
     * @return empty target
     */
    public static TableTarget none() {
        return NONE;
    }

    /**
     * Returns whether neither ID nor name is set.
     *
     * @return {@code true} for {@link #none()}
     */
    public boolean isEmpty() {
        return id == null && name == null;
    }
}
