package io.github.yok.prismlink.model;

import io.github.yok.prismlink.util.WireConstants;
import java.util.Arrays;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Write operations a bucket can apply to its target table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum BucketOperation {

    INSERT("Insert", false),

    UPDATE("Update", true),

    UPSERT("Upsert", true),

    DELETE("Delete", true),

    // Replaces every row of the table; with an empty file this truncates it.
    TRUNCATE_AND_INSERT("TruncateAndInsert", false);

    // Value used in the Operation_Type reference
    private final String wireName;

    // Whether one schema field must be flagged useAsOperationKey
    private final boolean operationKeyRequired;

    /**
     * Returns the {@code Operation_Type=<value>} reference ID.
     *
     * @return type reference ID
     */
    public String wireId() {
        return WireConstants.typeRef(WireConstants.OPERATION_TYPE, wireName);
    }

    /**
     * Resolves an operation from its wire name or enum name, ignoring case.
     *
     * @param value e.g. {@code TruncateAndInsert}, {@code upsert} or {@code TRUNCATE_AND_INSERT}
     * @return matching operation
     * @throws IllegalArgumentException if no operation matches
     */
    public static BucketOperation parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (BucketOperation op : values()) {
                if (op.wireName.equalsIgnoreCase(trimmed)
                        || op.name().equalsIgnoreCase(trimmed.replace('-', '_'))) {
                    return op;
                }
            }
        }
        String expected = Arrays.stream(values()).map(BucketOperation::getWireName)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Unknown bucket operation: " + value + ". Expected one of " + expected);
    }
}
