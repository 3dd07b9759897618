package io.github.yok.prismlink.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.prismlink.model.BucketOperation;
import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of {@link BucketManager#create(BucketRequest)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class BucketRequest {

    // Target table; when empty the schema must carry the table ID
    @Builder.Default
    TableTarget target = TableTarget.none();

    // Schema given as a value; takes precedence over schemaFile
    JsonNode schema;

    // Schema given as a JSON file
    Path schemaFile;

    // Parse options overriding those of the schema
    JsonNode parseOptions;

    // Bucket name; generated when null
    String bucketName;

    @Builder.Default
    BucketOperation operation = BucketOperation.TRUNCATE_AND_INSERT;
}
