package io.github.yok.prismlink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.prismlink.core.BucketManager;
import io.github.yok.prismlink.core.BucketRequest;
import io.github.yok.prismlink.core.DataChangeService;
import io.github.yok.prismlink.core.FileContainerService;
import io.github.yok.prismlink.core.FileStager;
import io.github.yok.prismlink.core.LoadOrchestrator;
import io.github.yok.prismlink.core.PageQuery;
import io.github.yok.prismlink.core.StagingTarget;
import io.github.yok.prismlink.core.TableService;
import io.github.yok.prismlink.core.TableTarget;
import io.github.yok.prismlink.model.Bucket;
import io.github.yok.prismlink.model.BucketOperation;
import io.github.yok.prismlink.model.DataChange;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.Table;
import io.github.yok.prismlink.model.TablePatch;
import io.github.yok.prismlink.schema.SchemaLoader;
import io.github.yok.prismlink.schema.SchemaNormalizer;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatches a parsed command line to the Prism services.
 *
 * <p>
 * Every command returns the object to print: a model object, a JSON tree, a paged result or, for
 * {@code buckets errorfile}, plain text. A missing resource addressed by ID raises
 * {@link PrismException} of kind {@link ErrorKind#NOT_FOUND}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

    static final String USAGE = String.join("\n",
            "usage: prismlink <group> <action> [arguments] [options]",
            "  tables get [TABLE] [--is-name] [--search] [--limit N] [--offset N]"
                    + " [--type summary|full|permissions] [--compact]",
            "  tables create [FILE] [--table-name NAME] [--display-name NAME]"
                    + " [--enable-for-analysis true|false] [--source-id ID] [--source-name NAME]",
            "  tables edit FILE [--table-id ID] [--table-name NAME] [--truncate]",
            "  tables patch TABLE [FILE] [--is-name] [--display-name V] [--description V]"
                    + " [--documentation V] [--enable-for-analysis true|false]",
            "  tables upload TABLE FILE... [--is-name] [--operation OP]",
            "  tables truncate TABLE [--is-name]",
            "  buckets get [BUCKET] [--is-name] [--search] [--table-id ID] [--table-name NAME]"
                    + " [--limit N] [--offset N] [--type summary|full]",
            "  buckets create [--table-id ID] [--table-name NAME] [--schema FILE]"
                    + " [--bucket-name NAME] [--operation OP]",
            "  buckets upload BUCKET FILE...",
            "  buckets complete BUCKET",
            "  buckets errorfile BUCKET",
            "  datachanges get [DATACHANGE] [--is-name] [--search] [--limit N] [--offset N]"
                    + " [--type summary|full]",
            "  datachanges validate DATACHANGE [--is-name]",
            "  datachanges run DATACHANGE [FILE...] [--is-name]",
            "  containers create",
            "  containers get CONTAINER",
            "  containers load FILE... [--container ID]");

    private final ObjectMapper mapper;
    private final TableService tables;
    private final BucketManager buckets;
    private final FileStager stager;
    private final LoadOrchestrator orchestrator;
    private final DataChangeService dataChanges;
    private final FileContainerService containers;
    private final SchemaLoader schemaLoader;

    /**
     * Executes a command.
     *
     * @param args parsed command line
     * @return the result to print, may be null
     * @throws IllegalArgumentException if the command line is incomplete or unknown
     * @throws PrismException if a Prism operation fails
     */
    public Object execute(CliArguments args) {
        if (args.getGroup() == null || args.getAction() == null) {
            throw new IllegalArgumentException("A command group and action are required.\n"
                    + USAGE);
        }
        String group = args.getGroup().toLowerCase(Locale.ROOT);
        String action = args.getAction().toLowerCase(Locale.ROOT);
        log.debug("Command: {} {}", group, action);
        switch (group) {
            case "tables":
                return tables(action, args);
            case "buckets":
                return buckets(action, args);
            case "datachanges":
                return dataChanges(action, args);
            case "containers":
                return containers(action, args);
            default:
                throw unknown(group, action);
        }
    }

    private Object tables(String action, CliArguments args) {
        switch (action) {
            case "get":
                return getTables(args);
            case "create":
                return tables.createTable(args.option("--table-name"),
                        args.option("--display-name"), args.booleanOption("--enable-for-analysis"),
                        schemaLoader.load(optionalPath(args.positional(0)),
                                args.option("--source-id"), args.option("--source-name")));
            case "edit":
                return tables.edit(schemaLoader.load(requiredPath(args, 0, "FILE"), null, null),
                        TableTarget.of(args.option("--table-id"), args.option("--table-name")),
                        orchestrator, args.flag("--truncate"));
            case "patch":
                return patchTable(args);
            case "upload":
                List<Path> files = args.paths(1);
                if (files.isEmpty()) {
                    throw new IllegalArgumentException("No files to upload.");
                }
                return orchestrator.load(tableTarget(args), files, operation(args));
            case "truncate":
                return orchestrator.truncate(tableTarget(args));
            default:
                throw unknown("tables", action);
        }
    }

    private Object getTables(CliArguments args) {
        String table = args.positional(0);
        String type = args.option("--type") == null ? "summary" : args.option("--type");
        boolean compact = args.flag("--compact");
        if (table != null && !args.flag("--is-name") && !args.flag("--search")) {
            Table found = tables.get(table, type).orElseThrow(
                    () -> new PrismException(ErrorKind.NOT_FOUND, table, "Table not found."));
            return compact ? SchemaNormalizer.normalize(mapper.valueToTree(found)) : found;
        }
        PageQuery<Table> query = PageQuery.<Table>builder().name(table)
                .searching(args.flag("--search")).limit(args.intOption("--limit"))
                .offset(args.intOption("--offset")).build();
        PagedResult<Table> found = tables.find(query, type);
        if (found.isEmpty()) {
            log.warn("No table found for {}", table == null ? "the listing" : table);
        }
        if (!compact) {
            return found;
        }
        List<ObjectNode> compacted = new ArrayList<>();
        for (Table t : found.getData()) {
            compacted.add(SchemaNormalizer.normalize(mapper.valueToTree(t)));
        }
        return new PagedResult<>(compacted);
    }

    private Object patchTable(CliArguments args) {
        String id = resolveTableId(args);
        TablePatch options = TablePatch.builder().displayName(args.option("--display-name"))
                .description(args.option("--description"))
                .documentation(args.option("--documentation"))
                .enableForAnalysis(args.booleanOption("--enable-for-analysis")).build();
        Path file = optionalPath(args.positional(1));
        if (file == null) {
            return tables.patch(id, options);
        }
        JsonNode fromFile = schemaLoader.readJson(file);
        if (!fromFile.isObject()) {
            throw new PrismException(ErrorKind.INVALID_SCHEMA, id,
                    "Invalid patch file; expected a JSON object.");
        }
        ObjectNode patch = (ObjectNode) fromFile;
        patch.setAll((ObjectNode) mapper.valueToTree(options));
        return tables.patch(id, patch);
    }

    private Object buckets(String action, CliArguments args) {
        switch (action) {
            case "get":
                return getBuckets(args);
            case "create":
                return buckets.create(BucketRequest.builder()
                        .target(TableTarget.of(args.option("--table-id"),
                                args.option("--table-name")))
                        .schemaFile(optionalPath(args.option("--schema")))
                        .bucketName(args.option("--bucket-name")).operation(operation(args))
                        .build());
            case "upload":
                return stager.stage(StagingTarget.bucket(required(args, 0, "BUCKET")),
                        args.paths(1));
            case "complete":
                return buckets.complete(required(args, 0, "BUCKET")).getBody();
            case "errorfile":
                String bucketId = required(args, 0, "BUCKET");
                return buckets.errorFile(bucketId).orElseThrow(() -> new PrismException(
                        ErrorKind.NOT_FOUND, bucketId, "No error file for bucket."));
            default:
                throw unknown("buckets", action);
        }
    }

    private Object getBuckets(CliArguments args) {
        String bucket = args.positional(0);
        String type = args.option("--type");
        if (bucket != null && !args.flag("--is-name") && !args.flag("--search")) {
            return buckets.get(bucket, type).orElseThrow(
                    () -> new PrismException(ErrorKind.NOT_FOUND, bucket, "Bucket not found."));
        }
        if (bucket == null && (args.option("--table-id") != null
                || args.option("--table-name") != null)) {
            return buckets.findByTable(args.option("--table-id"), args.option("--table-name"),
                    args.flag("--search"), type);
        }
        PageQuery<Bucket> query = PageQuery.<Bucket>builder().name(bucket)
                .searching(args.flag("--search")).limit(args.intOption("--limit"))
                .offset(args.intOption("--offset")).build();
        return buckets.find(query, type);
    }

    private Object dataChanges(String action, CliArguments args) {
        switch (action) {
            case "get":
                String dataChange = args.positional(0);
                String type = args.option("--type");
                if (dataChange != null && !args.flag("--is-name") && !args.flag("--search")) {
                    return dataChanges.get(dataChange, type)
                            .orElseThrow(() -> new PrismException(ErrorKind.NOT_FOUND,
                                    dataChange, "Data change not found."));
                }
                PageQuery<DataChange> query = PageQuery.<DataChange>builder().name(dataChange)
                        .searching(args.flag("--search")).limit(args.intOption("--limit"))
                        .offset(args.intOption("--offset")).build();
                return dataChanges.find(query, type);
            case "validate":
                String validated = resolveDataChangeId(args);
                return dataChanges.validate(validated).orElseThrow(() -> new PrismException(
                        ErrorKind.NOT_FOUND, validated, "Data change not found."));
            case "run":
                List<Path> files = args.paths(1);
                return dataChanges.run(resolveDataChangeId(args),
                        files.isEmpty() ? null : files);
            default:
                throw unknown("datachanges", action);
        }
    }

    private Object containers(String action, CliArguments args) {
        switch (action) {
            case "create":
                return containers.create();
            case "get":
                return containers.files(required(args, 0, "CONTAINER"));
            case "load":
                List<Path> files = args.paths(0);
                if (files.isEmpty()) {
                    throw new IllegalArgumentException("No files to load.");
                }
                return stager.stage(StagingTarget.fileContainer(args.option("--container")),
                        files);
            default:
                throw unknown("containers", action);
        }
    }

    private TableTarget tableTarget(CliArguments args) {
        String table = required(args, 0, "TABLE");
        return args.flag("--is-name") ? TableTarget.byName(table) : TableTarget.byId(table);
    }

    private String resolveTableId(CliArguments args) {
        String table = required(args, 0, "TABLE");
        if (!args.flag("--is-name")) {
            return table;
        }
        return tables.findByName(table).map(Table::getId).orElseThrow(() -> new PrismException(
                ErrorKind.TABLE_NOT_FOUND, table, "Table " + table + " not found."));
    }

    private String resolveDataChangeId(CliArguments args) {
        String dataChange = required(args, 0, "DATACHANGE");
        if (!args.flag("--is-name")) {
            return dataChange;
        }
        return dataChanges.findByName(dataChange).map(DataChange::getId)
                .orElseThrow(() -> new PrismException(ErrorKind.NOT_FOUND, dataChange,
                        "Data change " + dataChange + " not found."));
    }

    private static BucketOperation operation(CliArguments args) {
        String operation = args.option("--operation");
        return operation == null ? BucketOperation.TRUNCATE_AND_INSERT
                : BucketOperation.parse(operation);
    }

    private static String required(CliArguments args, int index, String name) {
        String value = args.positional(index);
        if (value == null) {
            throw new IllegalArgumentException(name + " argument is required for "
                    + args.getGroup() + " " + args.getAction() + ".");
        }
        return value;
    }

    private static Path requiredPath(CliArguments args, int index, String name) {
        return Paths.get(required(args, index, name));
    }

    private static Path optionalPath(String value) {
        return value == null ? null : Paths.get(value);
    }

    private static IllegalArgumentException unknown(String group, String action) {
        return new IllegalArgumentException(
                "Unknown command: " + group + " " + action + "\n" + USAGE);
    }
}
