package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.Table;
import io.github.yok.prismlink.model.TablePatch;
import io.github.yok.prismlink.schema.SchemaNormalizer;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import io.github.yok.prismlink.util.WireConstants;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Table catalog operations: lookups, create, full replace and attribute patch.
 *
 * <p>
 * Lookups never throw; absent tables are reported as {@link Optional#empty()} or an empty
 * {@link PagedResult}. Writes raise {@link PrismException} when the service refuses them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Service
public class TableService {

    // Output types accepted by table reads
    private static final Set<String> OUTPUT_TYPES =
            ImmutableSet.of("summary", "full", "permissions");

    private static final String DEFAULT_OUTPUT_TYPE = "summary";

    private final PrismHttpClient http;
    private final ObjectMapper mapper;
    private final PrismEndpoints endpoints;
    private final ResourcePager<Table> pager;

    /**
     * Creates the service.
     *
     * @param http HTTP collaborator
     * @param mapper JSON mapper
     * @param endpoints endpoint set
     * @param paging paging settings
     */
    public TableService(PrismHttpClient http, ObjectMapper mapper, PrismEndpoints endpoints,
            PagingConfig paging) {
        this.http = http;
        this.mapper = mapper;
        this.endpoints = endpoints;
        this.pager = new ResourcePager<>(http, mapper, () -> endpoints.prism("/tables"),
                Table.class, t -> ImmutableList.of(StringUtils.defaultString(t.getName()),
                        StringUtils.defaultString(t.getDisplayName())),
                paging.getTablePageSize(), paging.getDefaultLimit());
    }

    /**
     * Reads a table by ID.
     *
     * @param id table ID
     * @param outputType {@code summary}, {@code full} or {@code permissions}; anything else is
     *        read as {@code summary}
     * @return the table, or empty if it does not exist
     */
    public Optional<Table> get(String id, String outputType) {
        return pager.byId(id, Map.of("format", outputType(outputType)));
    }

    /**
     * Reads a table by exact API name, including its fields.
     *
     * @param name API name; spaces are read as underscores
     * @return the table, or empty if no table has that name
     */
    public Optional<Table> findByName(String name) {
        PageQuery<Table> query = PageQuery.<Table>builder().name(apiName(name))
                .param("type", "full").build();
        return Optional.ofNullable(pager.fetch(query).first());
    }

    /**
     * Lists or searches tables.
     *
     * @param query paging criteria; an exact name has its spaces replaced by underscores
     * @param outputType level of detail of each item
     * @return matching tables, possibly empty
     */
    public PagedResult<Table> find(PageQuery<Table> query, String outputType) {
        PageQuery.PageQueryBuilder<Table> builder =
                query.toBuilder().param("type", outputType(outputType));
        if (query.getName() != null && !query.isSearching()) {
            builder.name(apiName(query.getName()));
        }
        return pager.fetch(builder.build());
    }

    /**
     * Creates an empty table from a schema (POST, 201).
     *
     * @param schema raw schema; it is normalized before sending
     * @return the created table
     * @throws PrismException if the schema is invalid or the service refuses it
     */
    public Table create(JsonNode schema) {
        ObjectNode compact = SchemaNormalizer.normalize(schema);
        if (!compact.hasNonNull("name")) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "A table name is required to create a table.");
        }
        HttpResult result = http.post(endpoints.prism("/tables"), write(compact));
        if (!result.is(201)) {
            throw failure(compact.path("name").asText(), "create table", result);
        }
        log.info("Created table {}", compact.path("name").asText());
        return read(result, Table.class);
    }

    /**
     * Creates a table applying the command-line defaults.
     *
     * <ul>
     * <li>{@code name}, when given, becomes the API name (spaces replaced by underscores) and the
     * display name.</li>
     * <li>{@code displayName} defaults to the name.</li>
     * <li>{@code enableForAnalysis} defaults to {@code false}.</li>
     * </ul>
     *
     * @param name table name, may be null if the schema carries one
     * @param displayName display name, may be null
     * @param enableForAnalysis analysis flag, may be null
     * @param schema loaded schema
     * @return the created table
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if no name is available
     */
    public Table createTable(String name, String displayName, Boolean enableForAnalysis,
            JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, "A schema object is required.");
        }
        ObjectNode table = schema.deepCopy();
        if (name != null) {
            table.put("name", apiName(name));
            table.put("displayName", name);
        } else if (!table.hasNonNull("name")) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "A table name must be given when the schema has none.");
        }
        if (displayName != null) {
            table.put("displayName", displayName);
        } else if (!table.hasNonNull("displayName")) {
            table.put("displayName", table.get("name").asText());
        }
        if (enableForAnalysis != null) {
            table.put("enableForAnalysis", enableForAnalysis);
        } else if (!table.has("enableForAnalysis")) {
            table.put("enableForAnalysis", false);
        }
        return create(table);
    }

    /**
     * Replaces a table definition (PUT {@code tables/{id}}, 200).
     *
     * @param schema schema carrying {@code id} and {@code fields}
     * @return the updated table
     * @throws PrismException if the schema lacks {@code id} or {@code fields}, or the service
     *         refuses the update
     */
    public Table replace(JsonNode schema) {
        if (schema == null || !schema.hasNonNull("id") || !schema.has("fields")) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "A table update requires a schema with id and fields attributes.");
        }
        ObjectNode compact = SchemaNormalizer.normalize(schema);
        String id = compact.get("id").asText();
        HttpResult result = http.put(endpoints.prism("/tables/" + id), write(compact));
        if (!result.is(200)) {
            throw failure(id, "replace table", result);
        }
        log.info("Replaced table definition of {}", id);
        return read(result, Table.class);
    }

    /**
     * Edits a table: resolves the target, optionally truncates it, then replaces its definition.
     *
     * @param schema new definition
     * @param target target table, or {@link TableTarget#none()} to use the schema's ID
     * @param loader orchestrator used for the optional truncate, may be null when not truncating
     * @param truncateFirst whether to delete all rows before the replace
     * @return the updated table
     * @throws PrismException if no target can be resolved or the service refuses the update
     */
    public Table edit(JsonNode schema, TableTarget target, LoadOrchestrator loader,
            boolean truncateFirst) {
        if (schema == null || !schema.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, "A schema object is required.");
        }
        ObjectNode definition = schema.deepCopy();
        String id = resolveId(target, definition);
        definition.put("id", id);
        if (truncateFirst) {
            loader.truncate(TableTarget.byId(id));
        }
        return replace(definition);
    }

    /**
     * Updates table attributes (PATCH, 200).
     *
     * @param id table ID
     * @param patch attributes to change
     * @return the updated table
     * @throws PrismException if the patch is empty or the service refuses it
     */
    public Table patch(String id, TablePatch patch) {
        if (patch == null || patch.isEmpty()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, id,
                    "A patch must set at least one attribute.");
        }
        return sendPatch(id, mapper.valueToTree(patch));
    }

    /**
     * Updates table attributes from a JSON object, e.g. a patch file.
     *
     * @param id table ID
     * @param patch JSON object holding only patchable attributes
     * @return the updated table
     * @throws PrismException if the patch holds other attributes or the service refuses it
     */
    public Table patch(String id, JsonNode patch) {
        if (patch == null || !patch.isObject() || patch.size() == 0) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, id,
                    "A patch must be a JSON object setting at least one attribute.");
        }
        Iterator<String> names = patch.fieldNames();
        while (names.hasNext()) {
            String attribute = names.next();
            if (!WireConstants.PATCH_ATTRIBUTES.contains(attribute)) {
                throw new PrismException(ErrorKind.INVALID_SCHEMA, id,
                        "Attribute " + attribute + " cannot be patched; expected one of "
                                + WireConstants.PATCH_ATTRIBUTES + ".");
            }
        }
        return sendPatch(id, (ObjectNode) patch);
    }

    /**
     * Resolves a table ID: explicit ID, then exact name, then the {@code id} of the schema.
     *
     * @param target caller's target
     * @param schema schema that may carry an ID, may be null
     * @return the table ID
     * @throws PrismException {@link ErrorKind#MISSING_TARGET} if nothing identifies the table,
     *         {@link ErrorKind#TABLE_NOT_FOUND} if the named table does not exist
     */
    String resolveId(TableTarget target, JsonNode schema) {
        if (target != null && target.getId() != null) {
            return target.getId();
        }
        if (target != null && target.getName() != null) {
            return findByName(target.getName()).map(Table::getId)
                    .orElseThrow(() -> new PrismException(ErrorKind.TABLE_NOT_FOUND,
                            target.getName(), "Table " + target.getName() + " not found."));
        }
        if (schema != null && schema.hasNonNull("id")) {
            return schema.get("id").asText();
        }
        throw new PrismException(ErrorKind.MISSING_TARGET,
                "A table ID, table name or schema with an id is required.");
    }

    private Table sendPatch(String id, ObjectNode patch) {
        HttpResult result = http.patch(endpoints.prism("/tables/" + id), write(patch));
        if (!result.is(200)) {
            throw failure(id, "patch table", result);
        }
        log.info("Patched table {}: {}", id, patch);
        return read(result, Table.class);
    }

    /**
     * Converts a table name to its API form.
     *
     * @param name table name
     * @return the name with spaces replaced by underscores
     */
    static String apiName(String name) {
        return name == null ? null : name.replace(" ", "_");
    }

    private static String outputType(String requested) {
        if (requested == null || !OUTPUT_TYPES.contains(requested.toLowerCase(Locale.ROOT))) {
            log.warn("Invalid output type {} for a table read; using {}.", requested,
                    DEFAULT_OUTPUT_TYPE);
            return DEFAULT_OUTPUT_TYPE;
        }
        return requested.toLowerCase(Locale.ROOT);
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, null,
                    "Unable to serialize schema: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(HttpResult result, Class<T> type) {
        try {
            return mapper.readValue(result.getBody(), type);
        } catch (JsonProcessingException e) {
            throw new PrismException(ErrorKind.TRANSPORT_ERROR, null,
                    "Unreadable " + type.getSimpleName() + " response: " + e.getOriginalMessage(),
                    e);
        }
    }

    private static PrismException failure(String id, String action, HttpResult result) {
        log.error("Unable to {} {}: {} {}", action, id, result.getStatusCode(), result.getBody());
        return new PrismException(ErrorKind.TRANSPORT_ERROR, id, "Unable to " + action + " (status "
                + result.getStatusCode() + " " + result.getReason() + ").");
    }
}
