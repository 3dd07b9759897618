package io.github.yok.prismlink.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import io.github.yok.prismlink.core.DataSourceService;
import io.github.yok.prismlink.core.PageScan;
import io.github.yok.prismlink.core.TableService;
import io.github.yok.prismlink.model.DataSource;
import io.github.yok.prismlink.model.Table;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.LogPathUtil;
import io.github.yok.prismlink.util.PrismException;
import io.github.yok.prismlink.util.WireConstants;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Component;

/**
 * Loads table schemas from a JSON file, a CSV field-definition file or an existing table.
 *
 * <p>
 * A CSV definition file has one row per field and the header
 * {@code name,displayName,type,required,externalId,parseFormat,precision,scale,businessObject};
 * only {@code name} is mandatory. {@code Instance} fields name the business object of a WQL data
 * source in the {@code businessObject} column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaLoader {

    // CSV type column (lower case) to field type
    private static final Map<String, String> FIELD_TYPES = ImmutableMap.<String, String>builder()
            .put("text", "Text").put("integer", "Integer").put("boolean", "Boolean")
            .put("date", "Date").put("numeric", "Numeric").put("decimal", "Decimal")
            .put("instance", "Instance").build();

    private static final String DEFAULT_TYPE = "text";

    private final ObjectMapper mapper;
    private final TableService tables;
    private final DataSourceService dataSources;

    /**
     * Loads a schema from the first available source: file, then source table ID, then source
     * table name.
     *
     * @param file JSON or CSV file, may be null
     * @param sourceId ID of a table to copy, may be null
     * @param sourceName API name of a table to copy, may be null
     * @return schema object
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if no source is given or the source
     *         cannot be read
     */
    public ObjectNode load(Path file, String sourceId, String sourceName) {
        if (file != null) {
            if ("csv".equalsIgnoreCase(FilenameUtils.getExtension(file.getFileName().toString()))) {
                return fromCsv(file);
            }
            return fromJsonFile(file);
        }
        if (sourceId != null) {
            return fromTable(sourceId);
        }
        if (sourceName != null) {
            return fromTableName(sourceName);
        }
        throw new PrismException(ErrorKind.INVALID_SCHEMA,
                "No schema file given and no source table ID or name specified.");
    }

    /**
     * Reads a schema from a JSON file.
     *
     * <p>
     * A bare array is read as the field list of a schema. An object must carry {@code name} or
     * {@code fields}.
     * </p>
     *
     * @param file JSON file
     * @return schema object
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the file is missing, unreadable or
     *         holds no schema
     */
    public ObjectNode fromJsonFile(Path file) {
        String shown = LogPathUtil.renderPathForLog(file);
        JsonNode content = readJson(file);
        if (content.isArray()) {
            ObjectNode schema = mapper.createObjectNode();
            schema.set("fields", content);
            return schema;
        }
        if (!content.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "Schema file " + shown + " does not hold a JSON object or field array.");
        }
        if (!content.has("name") && !content.has("fields")) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "Invalid schema in " + shown + ": name and fields attributes not found.");
        }
        return (ObjectNode) content;
    }

    /**
     * Reads any JSON document from a file.
     *
     * @param file JSON file
     * @return parsed content, {@code MissingNode} for an empty file
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the file is missing or unreadable
     */
    public JsonNode readJson(Path file) {
        String shown = LogPathUtil.renderPathForLog(file);
        if (!Files.isRegularFile(file)) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, "File not found: " + shown);
        }
        try {
            return mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, null,
                    "Unable to read " + shown + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a schema holding only a field list from a CSV definition file.
     *
     * @param file CSV file with a header row
     * @return schema object with ordinals assigned in row order
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the file cannot be read, lacks a
     *         {@code name} column, or names an unknown business object
     */
    public ObjectNode fromCsv(Path file) {
        String shown = LogPathUtil.renderPathForLog(file);
        if (!Files.isRegularFile(file)) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, "Schema file not found: " + shown);
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setTrim(true).get();

        ObjectNode schema = mapper.createObjectNode();
        ArrayNode fields = schema.putArray("fields");
        List<DataSource> sources = null;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.builder().setReader(reader).setFormat(fmt).get()) {
            if (!parser.getHeaderMap().containsKey("name")) {
                throw new PrismException(ErrorKind.INVALID_SCHEMA,
                        "Schema file " + shown + " has no name column.");
            }
            int ordinal = 1;
            for (CSVRecord row : parser) {
                String name = column(row, "name");
                if (name == null) {
                    throw new PrismException(ErrorKind.INVALID_SCHEMA, "Row "
                            + row.getRecordNumber() + " of " + shown + " has no field name.");
                }
                ObjectNode field = fields.addObject();
                field.put("ordinal", ordinal++);
                field.put("name", name);
                field.put("displayName", StringUtils.defaultIfEmpty(column(row, "displayName"),
                        name));
                field.put("required", BooleanUtils.toBoolean(column(row, "required")));
                field.put("externalId", BooleanUtils.toBoolean(column(row, "externalId")));

                String type = fieldType(column(row, "type"));
                field.putObject("type").put("id",
                        WireConstants.typeRef(WireConstants.FIELD_TYPE, FIELD_TYPES.get(type)));
                switch (type) {
                    case "date":
                        putIfPresent(field, "parseFormat", column(row, "parseFormat"));
                        break;
                    case "numeric":
                    case "decimal":
                        putNumber(field, "precision", column(row, "precision"));
                        putNumber(field, "scale", column(row, "scale"));
                        break;
                    case "instance":
                        if (sources == null) {
                            sources = loadDataSources();
                        }
                        field.set("businessObject",
                                businessObject(sources, column(row, "businessObject")));
                        break;
                    default:
                        break;
                }
            }
        } catch (IOException e) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, null,
                    "Unable to read schema file " + shown + ": " + e.getMessage(), e);
        }
        log.debug("Read {} field definitions from {}", fields.size(), shown);
        return schema;
    }

    /**
     * Copies the schema of an existing table.
     *
     * @param id table ID
     * @return the table read with {@code format=full}
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the table does not exist
     */
    public ObjectNode fromTable(String id) {
        Table table = tables.get(id, "full").orElseThrow(() -> new PrismException(
                ErrorKind.INVALID_SCHEMA, id, "Source table " + id + " not found."));
        return mapper.valueToTree(table);
    }

    /**
     * Copies the schema of an existing table given its API name.
     *
     * @param name API name
     * @return the table read with {@code type=full}
     * @throws PrismException {@link ErrorKind#INVALID_SCHEMA} if the table does not exist
     */
    public ObjectNode fromTableName(String name) {
        Table table = tables.findByName(name).orElseThrow(() -> new PrismException(
                ErrorKind.INVALID_SCHEMA, name, "Source table " + name + " not found."));
        return mapper.valueToTree(table);
    }

    private List<DataSource> loadDataSources() {
        PageScan<DataSource> scan = dataSources.scan();
        if (!scan.isComplete() || scan.getFound().isEmpty()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA,
                    "Unable to list data sources for Instance fields (status "
                            + scan.getErrorStatus() + ").");
        }
        return scan.getFound();
    }

    private JsonNode businessObject(List<DataSource> sources, String descriptor) {
        List<DataSource> matches = sources.stream().filter(ds -> ds.getBusinessObject() != null)
                .filter(ds -> Objects.equals(descriptor, ds.getBusinessObject().getDescriptor()))
                .collect(Collectors.toList());
        if (matches.size() != 1) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, descriptor,
                    "Business object " + descriptor + " not found.");
        }
        return mapper.valueToTree(matches.get(0).getBusinessObject());
    }

    private static String fieldType(String column) {
        if (StringUtils.isEmpty(column)) {
            return DEFAULT_TYPE;
        }
        String type = column.toLowerCase(Locale.ROOT);
        if (!FIELD_TYPES.containsKey(type)) {
            log.warn("Invalid type {} detected; defaulting to Text.", column);
            return DEFAULT_TYPE;
        }
        return type;
    }

    private static String column(CSVRecord row, String name) {
        if (!row.isMapped(name) || !row.isSet(name)) {
            return null;
        }
        return StringUtils.trimToNull(row.get(name));
    }

    private static void putIfPresent(ObjectNode field, String attribute, String value) {
        if (value != null) {
            field.put(attribute, value);
        }
    }

    private static void putNumber(ObjectNode field, String attribute, String value) {
        if (value != null) {
            field.put(attribute, NumberUtils.toInt(value));
        }
    }
}
