package io.github.yok.prismlink.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A bucket: a staging area bound to one target table and one write operation.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Bucket extends PrismResource {

    // Operation_Type reference
    private TypeRef operation;

    // Target table reference
    private TypeRef targetDataset;

    // Lifecycle state, e.g. New, Processing, Success
    private TypeRef state;

    // File-parsing schema
    private JsonNode schema;

    private String errorMessage;
}
