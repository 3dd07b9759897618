package io.github.yok.prismlink.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.prismlink.config.PrismClientConfiguration;
import io.github.yok.prismlink.core.BucketCompletion;
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
import io.github.yok.prismlink.model.BucketOperation;
import io.github.yok.prismlink.model.DataChange;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.Table;
import io.github.yok.prismlink.model.TablePatch;
import io.github.yok.prismlink.schema.SchemaLoader;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class CommandRunnerTest {

    private final ObjectMapper mapper = PrismClientConfiguration.newObjectMapper();

    private TableService tables;
    private BucketManager buckets;
    private FileStager stager;
    private LoadOrchestrator orchestrator;
    private DataChangeService dataChanges;
    private FileContainerService containers;
    private SchemaLoader schemaLoader;

    private CommandRunner runner;

    @BeforeEach
    void setUp() {
        tables = mock(TableService.class);
        buckets = mock(BucketManager.class);
        stager = mock(FileStager.class);
        orchestrator = mock(LoadOrchestrator.class);
        dataChanges = mock(DataChangeService.class);
        containers = mock(FileContainerService.class);
        schemaLoader = mock(SchemaLoader.class);
        runner = new CommandRunner(mapper, tables, buckets, stager, orchestrator, dataChanges,
                containers, schemaLoader);
    }

    private Object run(String... args) {
        return runner.execute(CliArguments.parse(args));
    }

    private static Table table(String id, String name) {
        Table table = new Table();
        table.setId(id);
        table.setName(name);
        return table;
    }

    @Test
    void execute_正常ケース_tables_getにIDを指定する_IDで取得されること() {
        Table table = table("T1", "sales");
        when(tables.get("T1", "summary")).thenReturn(Optional.of(table));
        assertSame(table, run("tables", "get", "T1"));
    }

    @Test
    void execute_異常ケース_tables_getに存在しないIDを指定する_NOT_FOUNDが送出されること() {
        when(tables.get("T0", "full")).thenReturn(Optional.empty());
        PrismException ex = assertThrows(PrismException.class,
                () -> run("tables", "get", "T0", "--type", "full"));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        assertEquals("T0", ex.getResourceId());
    }

    @Test
    void execute_正常ケース_tables_getにcompactを指定する_正規化されたスキーマが返ること()
            throws Exception {
        Table table = mapper.readValue("{\"id\":\"T1\",\"name\":\"sales\",\"rowCount\":3,"
                + "\"fields\":[{\"id\":\"f\",\"name\":\"WPA_X\"},{\"name\":\"a\"}]}", Table.class);
        when(tables.get("T1", "full")).thenReturn(Optional.of(table));

        ObjectNode compact =
                (ObjectNode) run("tables", "get", "T1", "--type", "full", "--compact");

        assertFalse(compact.has("rowCount"));
        assertEquals(1, compact.get("fields").size());
        assertEquals("a", compact.get("fields").get(0).get("name").asText());
    }

    @SuppressWarnings("unchecked")
    @Test
    void execute_正常ケース_tables_getに検索語を指定する_検索条件で一覧されること() {
        when(tables.find(any(), eq("summary"))).thenReturn(PagedResult.empty());

        run("tables", "get", "sal", "--search", "--limit", "5");

        ArgumentCaptor<PageQuery<Table>> query = ArgumentCaptor.forClass(PageQuery.class);
        verify(tables).find(query.capture(), eq("summary"));
        assertEquals("sal", query.getValue().getName());
        assertTrue(query.getValue().isSearching());
        assertEquals(5, query.getValue().getLimit());
    }

    @Test
    void execute_正常ケース_tables_uploadに名前と操作を指定する_名前指定でロードされること() {
        run("tables", "upload", "sales", "a.csv", "b.csv", "--is-name", "--operation", "upsert");
        verify(orchestrator).load(TableTarget.byName("sales"),
                List.of(Paths.get("a.csv"), Paths.get("b.csv")), BucketOperation.UPSERT);
    }

    @Test
    void execute_異常ケース_tables_uploadにファイルを指定しない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> run("tables", "upload", "T1"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void execute_正常ケース_tables_truncateにIDを指定する_ID指定で切り詰められること() {
        run("tables", "truncate", "T1");
        verify(orchestrator).truncate(TableTarget.byId("T1"));
    }

    @Test
    void execute_正常ケース_tables_patchにオプションのみ指定する_属性パッチが送信されること() {
        run("tables", "patch", "T1", "--display-name", "Sales", "--enable-for-analysis", "true");
        verify(tables).patch("T1",
                TablePatch.builder().displayName("Sales").enableForAnalysis(true).build());
    }

    @Test
    void execute_正常ケース_tables_patchにファイルと名前を指定する_ファイルとオプションが合成されること()
            throws Exception {
        Path file = Paths.get("patch.json");
        when(tables.findByName("sales")).thenReturn(Optional.of(table("T7", "sales")));
        when(schemaLoader.readJson(file)).thenReturn(mapper.readTree(
                "{\"description\":\"from file\",\"displayName\":\"old\"}"));

        run("tables", "patch", "sales", "patch.json", "--is-name", "--display-name", "new");

        JsonNode expected =
                mapper.readTree("{\"description\":\"from file\",\"displayName\":\"new\"}");
        verify(tables).patch("T7", expected);
    }

    @Test
    void execute_正常ケース_tables_createにCSVを指定する_既定値付きで作成されること()
            throws Exception {
        ObjectNode schema = (ObjectNode) mapper.readTree("{\"fields\":[]}");
        when(schemaLoader.load(Paths.get("fields.csv"), null, null)).thenReturn(schema);

        run("tables", "create", "fields.csv", "--table-name", "Monthly Sales");

        verify(tables).createTable("Monthly Sales", null, null, schema);
    }

    @Test
    void execute_正常ケース_buckets_createを指定する_リクエストに各オプションが反映されること() {
        run("buckets", "create", "--table-name", "sales", "--schema", "s.json", "--operation",
                "Insert", "--bucket-name", "nightly");

        ArgumentCaptor<BucketRequest> request = ArgumentCaptor.forClass(BucketRequest.class);
        verify(buckets).create(request.capture());
        assertEquals(TableTarget.byName("sales"), request.getValue().getTarget());
        assertEquals(Paths.get("s.json"), request.getValue().getSchemaFile());
        assertEquals(BucketOperation.INSERT, request.getValue().getOperation());
        assertEquals("nightly", request.getValue().getBucketName());
    }

    @Test
    void execute_正常ケース_buckets_completeを指定する_応答本文が返ること() throws Exception {
        JsonNode body = mapper.readTree("{\"errors\":[]}");
        when(buckets.complete("B1")).thenReturn(new BucketCompletion(400, body));
        assertSame(body, run("buckets", "complete", "B1"));
    }

    @Test
    void execute_正常ケース_buckets_getにテーブル名と検索を指定する_対象テーブルで絞り込まれること() {
        run("buckets", "get", "--table-name", "sales", "--search");
        verify(buckets).findByTable(null, "sales", true, null);
    }

    @Test
    void execute_正常ケース_buckets_errorfileを指定する_テキストが返り無ければNOT_FOUNDとなること() {
        when(buckets.errorFile("B1")).thenReturn(Optional.of("row,error\n"));
        when(buckets.errorFile("B2")).thenReturn(Optional.empty());
        assertEquals("row,error\n", run("buckets", "errorfile", "B1"));
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(PrismException.class,
                () -> run("buckets", "errorfile", "B2")).getKind());
    }

    @Test
    void execute_正常ケース_buckets_uploadを指定する_バケットへステージされること() {
        run("buckets", "upload", "B1", "a.csv.gz");
        verify(stager).stage(StagingTarget.bucket("B1"), List.of(Paths.get("a.csv.gz")));
    }

    @Test
    void execute_正常ケース_datachanges_runに名前とファイルを指定する_解決したIDで実行されること() {
        DataChange dc = new DataChange();
        dc.setId("DC9");
        when(dataChanges.findByName("load_sales")).thenReturn(Optional.of(dc));

        run("datachanges", "run", "load_sales", "a.csv", "--is-name");

        verify(dataChanges).run("DC9", List.of(Paths.get("a.csv")));
    }

    @Test
    void execute_正常ケース_datachanges_runにファイルを指定しない_ファイル無しで実行されること() {
        run("datachanges", "run", "DC1");
        verify(dataChanges).run("DC1", null);
    }

    @Test
    void execute_異常ケース_datachanges_validateに存在しないIDを指定する_NOT_FOUNDが送出されること() {
        when(dataChanges.validate("DC0")).thenReturn(Optional.empty());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(PrismException.class,
                () -> run("datachanges", "validate", "DC0")).getKind());
    }

    @Test
    void execute_正常ケース_containers_loadにコンテナIDを指定する_既存コンテナへステージされること() {
        run("containers", "load", "a.csv", "b.csv", "--container", "C1");
        verify(stager).stage(StagingTarget.fileContainer("C1"),
                List.of(Paths.get("a.csv"), Paths.get("b.csv")));
    }

    @Test
    void execute_異常ケース_不完全または未知のコマンドを指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> run("tables"));
        assertThrows(IllegalArgumentException.class, () -> run("views", "get"));
        assertThrows(IllegalArgumentException.class, () -> run("tables", "drop"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> run("buckets", "complete"));
        assertTrue(ex.getMessage().contains("BUCKET"));
        assertNull(CliArguments.parse().getGroup());
    }
}
