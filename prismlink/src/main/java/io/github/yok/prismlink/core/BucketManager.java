package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.ImmutableList;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.Bucket;
import io.github.yok.prismlink.model.BucketOperation;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.Table;
import io.github.yok.prismlink.model.TypeRef;
import io.github.yok.prismlink.schema.SchemaLoader;
import io.github.yok.prismlink.schema.SchemaNormalizer;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Bucket lifecycle: creation against a resolved target table, completion and lookups.
 *
 * <p>
 * The target table of a new bucket is resolved in this order:
 * </p>
 * <ol>
 * <li>explicit table ID</li>
 * <li>explicit table name, looked up by exact API name</li>
 * <li>the {@code id} attribute of the supplied schema</li>
 * </ol>
 * <p>
 * A supplied schema always provides the fields; otherwise the live schema of the target table is
 * used. Either way the schema is normalized and converted into a bucket schema before sending.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Service
public class BucketManager {

    private static final String DEFAULT_OUTPUT_TYPE = "summary";

    private final PrismHttpClient http;
    private final ObjectMapper mapper;
    private final PrismEndpoints endpoints;
    private final PrismConfig config;
    private final TableService tables;
    private final SchemaLoader schemaLoader;
    private final ResourcePager<Bucket> pager;

    /**
     * Creates the manager.
     *
     * @param http HTTP collaborator
     * @param mapper JSON mapper
     * @param endpoints endpoint set
     * @param config connection settings, for the bucket name prefix
     * @param paging paging settings
     * @param tables table service used to resolve targets
     * @param schemaLoader loader for schema files
     */
    public BucketManager(PrismHttpClient http, ObjectMapper mapper, PrismEndpoints endpoints,
            PrismConfig config, PagingConfig paging, TableService tables,
            SchemaLoader schemaLoader) {
        this.http = http;
        this.mapper = mapper;
        this.endpoints = endpoints;
        this.config = config;
        this.tables = tables;
        this.schemaLoader = schemaLoader;
        this.pager = new ResourcePager<>(http, mapper, () -> endpoints.prism("/buckets"),
                Bucket.class, b -> ImmutableList.of(StringUtils.defaultString(b.getName()),
                        StringUtils.defaultString(b.getDisplayName())),
                paging.getBucketPageSize(), paging.getDefaultLimit());
    }

    /**
     * Creates a bucket (POST, 201).
     *
     * @param request target, schema, name and operation
     * @return the created bucket, with its ID
     * @throws PrismException {@link ErrorKind#MISSING_TARGET}, {@link ErrorKind#TABLE_NOT_FOUND},
     *         {@link ErrorKind#INVALID_SCHEMA} or {@link ErrorKind#BUCKET_CREATE_FAILED}
     */
    public Bucket create(BucketRequest request) {
        JsonNode supplied = request.getSchema();
        if (supplied == null && request.getSchemaFile() != null) {
            supplied = schemaLoader.fromJsonFile(request.getSchemaFile());
        }
        if (supplied != null && !supplied.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "A bucket schema must be a JSON object.");
        }
        JsonNode parseOptions = request.getParseOptions() != null ? request.getParseOptions()
                : supplied == null ? null : supplied.get("parseOptions");

        ObjectNode schema = resolveSchema(request.getTarget(), supplied);
        String targetId = schema.get("id").asText();

        ObjectNode bucketSchema =
                SchemaNormalizer.toBucketSchema(SchemaNormalizer.normalize(schema), parseOptions);
        BucketOperation operation = request.getOperation();
        if (operation.isOperationKeyRequired() && !SchemaNormalizer.hasOperationKey(bucketSchema)) {
            log.warn("Operation {} on table {} needs an operation key but no field is marked"
                    + " externalId.", operation.getWireName(), targetId);
        }

        String name = request.getBucketName() != null ? request.getBucketName() : generateName();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("name", name);
        payload.putObject("operation").put("id", operation.wireId());
        payload.putObject("targetDataset").put("id", targetId);
        payload.set("schema", bucketSchema);

        HttpResult result = http.post(endpoints.prism("/buckets"), write(payload, targetId));
        if (!result.is(201)) {
            log.error("Unable to create bucket {} for table {}: {} {}", name, targetId,
                    result.getStatusCode(), result.getBody());
            throw new PrismException(ErrorKind.BUCKET_CREATE_FAILED, targetId,
                    "Unable to create bucket for table " + targetId + " (status "
                            + result.getStatusCode() + " " + result.getReason() + ").");
        }
        Bucket bucket = read(result, Bucket.class, ErrorKind.BUCKET_CREATE_FAILED, targetId);
        log.debug("Created bucket {} ({}) for table {}", bucket.getId(), name, targetId);
        return bucket;
    }

    /**
     * Completes a bucket, committing its files into the target table (POST, 201).
     *
     * @param bucketId bucket ID
     * @return the answer; a 400 answer carries row-level validation errors and is not raised
     * @throws PrismException {@link ErrorKind#BUCKET_COMPLETE_FAILED} for any other status
     */
    public BucketCompletion complete(String bucketId) {
        HttpResult result = http.post(endpoints.prism("/buckets/" + bucketId + "/complete"), null);
        if (result.is(201)) {
            log.debug("Completed bucket {}", bucketId);
            return new BucketCompletion(201, body(result));
        }
        if (result.is(400)) {
            log.debug("Bucket {} completed with validation errors", bucketId);
            return new BucketCompletion(400, body(result));
        }
        log.error("Unable to complete bucket {}: {} {}", bucketId, result.getStatusCode(),
                result.getBody());
        throw new PrismException(ErrorKind.BUCKET_COMPLETE_FAILED, bucketId,
                "Unable to complete bucket " + bucketId + " (status " + result.getStatusCode()
                        + " " + result.getReason() + ").");
    }

    /**
     * Reads a bucket by ID.
     *
     * @param bucketId bucket ID
     * @param outputType {@code summary} or {@code full}; anything else is read as summary
     * @return the bucket, or empty if it does not exist
     */
    public Optional<Bucket> get(String bucketId, String outputType) {
        return pager.byId(bucketId, Map.of("format", outputType(outputType)));
    }

    /**
     * Lists or searches buckets by name.
     *
     * @param query paging criteria
     * @param outputType level of detail of each item
     * @return matching buckets, possibly empty
     */
    public PagedResult<Bucket> find(PageQuery<Bucket> query, String outputType) {
        return pager.fetch(query.toBuilder().param("type", outputType(outputType)).build());
    }

    /**
     * Lists the buckets of a target table.
     *
     * <p>
     * A table ID matches the target exactly. A table name matches the target descriptor exactly,
     * or as a case-insensitive substring when searching.
     * </p>
     *
     * @param tableId target table ID, takes precedence over the name
     * @param tableName target table name
     * @param searching whether the name is a substring
     * @param outputType level of detail of each item
     * @return matching buckets, possibly empty
     */
    public PagedResult<Bucket> findByTable(String tableId, String tableName, boolean searching,
            String outputType) {
        Predicate<Bucket> filter;
        if (tableId != null) {
            filter = b -> b.getTargetDataset() != null
                    && tableId.equals(b.getTargetDataset().getId());
        } else if (tableName != null) {
            String lower = tableName.toLowerCase(Locale.ROOT);
            filter = b -> {
                TypeRef target = b.getTargetDataset();
                if (target == null || target.getDescriptor() == null) {
                    return false;
                }
                return tableName.equals(target.getDescriptor()) || (searching
                        && target.getDescriptor().toLowerCase(Locale.ROOT).contains(lower));
            };
        } else {
            filter = null;
        }
        PageQuery<Bucket> query = PageQuery.<Bucket>builder().filter(filter)
                .param("type", outputType(outputType)).build();
        return pager.fetch(query);
    }

    /**
     * Fetches the error file of a bucket: the raw text of the rows that failed to load.
     *
     * @param bucketId bucket ID
     * @return error file text, or empty if the service has none
     */
    public Optional<String> errorFile(String bucketId) {
        HttpResult result = http.get(endpoints.prism("/buckets/" + bucketId + "/errorFile"));
        if (!result.is(200)) {
            log.debug("No error file for bucket {} (status {})", bucketId,
                    result.getStatusCode());
            return Optional.empty();
        }
        return Optional.ofNullable(result.getBody());
    }

    private ObjectNode resolveSchema(TableTarget target, JsonNode supplied) {
        if (target == null || target.isEmpty()) {
            if (supplied == null) {
                throw new PrismException(ErrorKind.MISSING_TARGET,
                        "A schema, target table ID or target table name is required.");
            }
            if (!supplied.hasNonNull("id")) {
                throw new PrismException(ErrorKind.MISSING_TARGET,
                        "The schema has no id attribute identifying the target table.");
            }
            if (!supplied.has("fields")) {
                throw new PrismException(ErrorKind.INVALID_SCHEMA,
                        supplied.get("id").asText(), "The schema has no fields attribute.");
            }
            return supplied.deepCopy();
        }

        Table table;
        if (target.getId() != null) {
            table = tables.get(target.getId(), "full")
                    .orElseThrow(() -> new PrismException(ErrorKind.TABLE_NOT_FOUND,
                            target.getId(), "Table ID " + target.getId() + " not found."));
        } else {
            table = tables.findByName(target.getName())
                    .orElseThrow(() -> new PrismException(ErrorKind.TABLE_NOT_FOUND,
                            target.getName(), "Table " + target.getName()
                                    + " not found for bucket operation."));
        }
        if (supplied == null) {
            return mapper.valueToTree(table);
        }
        ObjectNode schema = supplied.deepCopy();
        schema.put("id", table.getId());
        return schema;
    }

    private String generateName() {
        return config.getBucketNamePrefix() + UUID.randomUUID().toString().replace("-", "");
    }

    private JsonNode body(HttpResult result) {
        if (result.getBody() == null) {
            return NullNode.getInstance();
        }
        try {
            return mapper.readTree(result.getBody());
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(result.getBody());
        }
    }

    private String write(JsonNode node, String targetId) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PrismException(ErrorKind.BUCKET_CREATE_FAILED, targetId,
                    "Unable to serialize bucket request: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(HttpResult result, Class<T> type, ErrorKind kind, String id) {
        try {
            return mapper.readValue(result.getBody(), type);
        } catch (JsonProcessingException e) {
            throw new PrismException(kind, id,
                    "Unreadable " + type.getSimpleName() + " response: " + e.getOriginalMessage(),
                    e);
        }
    }

    private static String outputType(String requested) {
        if (requested != null && requested.equalsIgnoreCase("full")) {
            return "full";
        }
        return DEFAULT_OUTPUT_TYPE;
    }
}
