package io.github.yok.prismlink.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import io.github.yok.prismlink.util.WireConstants;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Reduces table schemas to the forms accepted by write operations.
 *
 * <p>
 * Both transforms work on a deep copy; the caller's node is never modified.
 * </p>
 * <ul>
 * <li>{@link #normalize(JsonNode)} produces the <em>compact</em> schema accepted by table
 * POST/PUT.</li>
 * <li>{@link #toBucketSchema(JsonNode, JsonNode)} derives the file-parsing schema of a bucket from
 * a compact schema.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SchemaNormalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    // Field attributes assigned by the server
    private static final List<String> SERVER_FIELD_ATTRIBUTES = List.of("id", "fieldId");

    // Field attributes not part of a bucket schema
    private static final List<String> TABLE_ONLY_FIELD_ATTRIBUTES =
            List.of("id", "displayName", "fieldId", "required", "externalId");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private SchemaNormalizer() {
        throw new AssertionError(
                "No io.github.yok.prismlink.schema.SchemaNormalizer instances for you!");
    }

    /**
     * Produces the compact form of a schema.
     *
     * <ul>
     * <li>Fields named with the reserved {@code WPA_} prefix are dropped.</li>
     * <li>Surviving fields get {@code ordinal = position + 1}, in their original order.</li>
     * <li>Field {@code id} and {@code fieldId} are removed.</li>
     * <li>A type {@code descriptor} becomes the type ID
     * {@code Schema_Field_Type=<descriptor>}.</li>
     * <li>Top-level attributes outside the allow-list are removed.</li>
     * </ul>
     *
     * <p>
     * A schema without {@code fields} (summary tables) is accepted and only has its top-level
     * attributes filtered.
     * </p>
     *
     * @param schema raw schema, e.g. a table read with {@code type=full}
     * @return compact schema (a new node)
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the schema is absent, not a JSON
     *         object, or has malformed fields
     */
    public static ObjectNode normalize(JsonNode schema) {
        ObjectNode compact = requireObject(schema, "schema").deepCopy();

        if (compact.has("fields")) {
            List<ObjectNode> fields = userFields(compact.get("fields"));
            ArrayNode ordered = NODES.arrayNode();
            for (int i = 0; i < fields.size(); i++) {
                ObjectNode field = fields.get(i);
                field.put("ordinal", i + 1);
                field.remove(SERVER_FIELD_ATTRIBUTES);
                JsonNode type = field.get("type");
                if (type != null && type.isObject() && type.has("descriptor")) {
                    ObjectNode typeNode = (ObjectNode) type;
                    typeNode.put("id", WireConstants.typeRef(WireConstants.FIELD_TYPE,
                            typeNode.get("descriptor").asText()));
                    typeNode.remove("descriptor");
                }
                ordered.add(field);
            }
            compact.set("fields", ordered);
        }

        Iterator<Map.Entry<String, JsonNode>> it = compact.fields();
        while (it.hasNext()) {
            String key = it.next().getKey();
            if (!WireConstants.SCHEMA_ATTRIBUTES.contains(key)) {
                it.remove();
            }
        }
        return compact;
    }

    /**
     * Derives a bucket schema, taking parse options from the schema itself when it carries them.
     *
     * @param compactSchema compact schema
     * @return bucket schema (a new node)
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the schema has no fields
     */
    public static ObjectNode toBucketSchema(JsonNode compactSchema) {
        JsonNode parseOptions = compactSchema == null ? null : compactSchema.get("parseOptions");
        return toBucketSchema(compactSchema, parseOptions);
    }

    /**
     * Derives the file-parsing schema of a bucket from a compact schema.
     *
     * <ul>
     * <li>Reserved-prefix fields are dropped again.</li>
     * <li>{@code useAsOperationKey} is {@code true} exactly for fields marked
     * {@code externalId}.</li>
     * <li>{@code id}, {@code displayName}, {@code fieldId}, {@code required} and
     * {@code externalId} are removed from each field.</li>
     * <li>{@code parseOptions} are used verbatim when given; otherwise
     * {@link #defaultParseOptions()} apply.</li>
     * </ul>
     *
     * @param compactSchema compact schema
     * @param parseOptions caller-supplied parse options, may be {@code null}
     * @return bucket schema (a new node)
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the schema has no fields
     */
    public static ObjectNode toBucketSchema(JsonNode compactSchema, JsonNode parseOptions) {
        ObjectNode source = requireObject(compactSchema, "compact schema");
        if (!source.has("fields")) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, textOrNull(source, "id"),
                    "Schema has no fields attribute; a bucket schema cannot be derived.");
        }

        ArrayNode fields = NODES.arrayNode();
        for (ObjectNode field : userFields(source.get("fields").deepCopy())) {
            JsonNode externalId = field.get("externalId");
            field.put("useAsOperationKey", externalId != null && externalId.asBoolean(false));
            field.remove(TABLE_ONLY_FIELD_ATTRIBUTES);
            fields.add(field);
        }

        ObjectNode bucketSchema = NODES.objectNode();
        bucketSchema.putObject("schemaVersion")
                .put("id", WireConstants.typeRef(WireConstants.SCHEMA_VERSION, "1.0"));
        if (parseOptions != null && parseOptions.isObject()) {
            bucketSchema.set("parseOptions", parseOptions.deepCopy());
        } else {
            bucketSchema.set("parseOptions", defaultParseOptions());
        }
        bucketSchema.set("fields", fields);
        return bucketSchema;
    }

    /**
     * Returns the default parse options: comma delimited, double-quote enclosed, one header line,
     * UTF-8, delimited file.
     *
     * @return new parse options node
     */
    public static ObjectNode defaultParseOptions() {
        ObjectNode options = NODES.objectNode();
        options.put("fieldsDelimitedBy", ",");
        options.put("fieldsEnclosedBy", "\"");
        options.put("headerLinesToIgnore", 1);
        options.putObject("charset")
                .put("id", WireConstants.typeRef(WireConstants.ENCODING, "UTF-8"));
        options.putObject("type")
                .put("id", WireConstants.typeRef(WireConstants.FILE_TYPE, "Delimited"));
        return options;
    }

    /**
     * Returns whether any field of a bucket schema is flagged as the operation key.
     *
     * @param bucketSchema bucket schema
     * @return {@code true} if at least one field has {@code useAsOperationKey=true}
     */
    public static boolean hasOperationKey(JsonNode bucketSchema) {
        JsonNode fields = bucketSchema == null ? null : bucketSchema.get("fields");
        if (fields == null || !fields.isArray()) {
            return false;
        }
        for (JsonNode field : fields) {
            if (field.path("useAsOperationKey").asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    private static ObjectNode requireObject(JsonNode node, String what) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, what + " is required.");
        }
        if (!node.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    what + " must be a JSON object but was " + node.getNodeType() + ".");
        }
        return (ObjectNode) node;
    }

    private static List<ObjectNode> userFields(JsonNode fields) {
        if (!fields.isArray()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, "fields must be a JSON array.");
        }
        List<ObjectNode> kept = new ArrayList<>();
        for (JsonNode field : fields) {
            if (!field.isObject() || !field.path("name").isTextual()) {
                throw new PrismException(ErrorKind.INVALID_SCHEMA,
                        "Every field must be a JSON object with a name: " + field);
            }
            String name = field.get("name").asText();
            if (name.startsWith(WireConstants.RESERVED_FIELD_PREFIX)) {
                log.debug("Dropping reserved field {}", name);
                continue;
            }
            kept.add((ObjectNode) field);
        }
        return kept;
    }

    private static String textOrNull(JsonNode node, String attribute) {
        JsonNode value = node.get(attribute);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
