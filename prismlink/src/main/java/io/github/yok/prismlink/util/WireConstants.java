package io.github.yok.prismlink.util;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import lombok.Generated;

/**
 * Wire-level constants shared by the schema, bucket and staging code.
 *
 * @author Yasuharu.Okawauchi
 */
public final class WireConstants {

    // Prefix of fields managed by Prism itself (never written by clients)
    public static final String RESERVED_FIELD_PREFIX = "WPA_";

    // Type-reference categories, rendered as "<Category>=<Value>"
    public static final String FIELD_TYPE = "Schema_Field_Type";
    public static final String OPERATION_TYPE = "Operation_Type";
    public static final String SCHEMA_VERSION = "Schema_Version";
    public static final String ENCODING = "Encoding";
    public static final String FILE_TYPE = "Schema_File_Type";

    // Top-level schema attributes accepted by table POST/PUT
    public static final Set<String> SCHEMA_ATTRIBUTES = ImmutableSet.of("name", "id", "fields",
            "tags", "categories", "displayName", "description", "documentation",
            "enableForAnalysis");

    // Table attributes accepted by PATCH
    public static final Set<String> PATCH_ATTRIBUTES =
            ImmutableSet.of("displayName", "description", "documentation", "enableForAnalysis");

    // Upload suffixes
    public static final String CSV_SUFFIX = ".csv";
    public static final String GZIP_SUFFIX = ".gz";
    public static final String CSV_GZIP_SUFFIX = CSV_SUFFIX + GZIP_SUFFIX;

    // Name of the zero-length payload used to truncate a table
    public static final String EMPTY_UPLOAD_NAME = "empty.csv.gz";

    /**
     * Prevents instantiation of this constants holder.
     */
    @Generated
    private WireConstants() {
        throw new AssertionError(
                "No io.github.yok.prismlink.util.WireConstants instances for you!");
    }

    /**
     * Renders a type reference such as {@code Schema_Field_Type=Text}.
     *
     * @param category reference category
     * @param value reference value
     * @return the {@code <Category>=<Value>} form
     */
    public static String typeRef(String category, String value) {
        return category + "=" + value;
    }
}
