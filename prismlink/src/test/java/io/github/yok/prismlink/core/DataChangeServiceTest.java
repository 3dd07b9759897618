package io.github.yok.prismlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismClientConfiguration;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.DataChange;
import io.github.yok.prismlink.model.UploadReceipt;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DataChangeServiceTest {

    private static final String PRISM = "https://prism.example.com/api/prismAnalytics/v3/acme";

    private PrismHttpClient http;

    private FileStager stager;

    private DataChangeService service;

    @BeforeEach
    void setUp() {
        PrismConfig config = new PrismConfig();
        config.setBaseUrl("https://prism.example.com");
        config.setTenantName("acme");
        http = mock(PrismHttpClient.class);
        stager = mock(FileStager.class);
        service = new DataChangeService(http, PrismClientConfiguration.newObjectMapper(),
                new PrismEndpoints(config), new PagingConfig(), stager);
    }

    private static HttpResult ok(int status, String json) {
        return new HttpResult(status, json, "");
    }

    @Test
    void get_正常ケース_IDを指定する_typeパラメータ付きで取得されること() {
        when(http.get(PRISM + "/dataChanges/DC1", Map.of("type", "full")))
                .thenReturn(ok(200, "{\"id\":\"DC1\",\"name\":\"load_sales\"}"));
        Optional<DataChange> dc = service.get("DC1", "full");
        assertEquals("load_sales", dc.get().getName());
    }

    @Test
    void isValid_正常ケース_各検証結果を指定する_指定したIDの結果で判定されること() {
        when(http.get(PRISM + "/dataChanges/GOOD/validate"))
                .thenReturn(ok(200, "{\"id\":\"GOOD\"}"));
        when(http.get(PRISM + "/dataChanges/BAD/validate"))
                .thenReturn(ok(400, "{\"errors\":[{\"error\":\"invalid source\"}]}"));
        when(http.get(PRISM + "/dataChanges/GONE/validate"))
                .thenReturn(ok(404, "{\"error\":\"not found\"}"));
        when(http.get(PRISM + "/dataChanges/DOWN/validate"))
                .thenReturn(HttpResult.transportFailure("refused"));

        assertTrue(service.isValid("GOOD"));
        assertFalse(service.isValid("BAD"));
        assertFalse(service.isValid("GONE"));
        assertFalse(service.isValid("DOWN"));
        assertTrue(service.validate("BAD").get().has("errors"));
        assertFalse(service.validate("DOWN").isPresent());
    }

    @Test
    void isValid_異常ケース_404が空または非JSONの本文で返る_falseが返ること() {
        when(http.get(PRISM + "/dataChanges/EMPTY/validate")).thenReturn(ok(404, ""));
        when(http.get(PRISM + "/dataChanges/HTML/validate"))
                .thenReturn(ok(404, "<html>Not Found</html>"));

        assertFalse(service.isValid("EMPTY"));
        assertFalse(service.isValid("HTML"));
    }

    @Test
    void start_正常ケース_コンテナIDを指定する_fileContainerWidが送信されること() {
        when(http.post(PRISM + "/dataChanges/DC1/activities", "{\"fileContainerWid\":\"C1\"}"))
                .thenReturn(ok(201, "{\"id\":\"A1\"}"));
        ActivityStart started = service.start("DC1", "C1");
        assertTrue(started.isStarted());
        assertEquals("A1", started.getActivityId());
    }

    @Test
    void start_正常ケース_400が返る_エラー本文が返ること() {
        when(http.post(PRISM + "/dataChanges/DC1/activities", null))
                .thenReturn(ok(400, "{\"errors\":[{\"error\":\"no files\"}]}"));
        ActivityStart answer = service.start("DC1", null);
        assertFalse(answer.isStarted());
        assertNull(answer.getActivityId());
        assertTrue(answer.getBody().has("errors"));
    }

    @Test
    void start_異常ケース_500が返る_TRANSPORT_ERRORが送出されること() {
        when(http.post(PRISM + "/dataChanges/DC1/activities", null))
                .thenReturn(ok(500, "boom"));
        PrismException ex = assertThrows(PrismException.class, () -> service.start("DC1", null));
        assertEquals(ErrorKind.TRANSPORT_ERROR, ex.getKind());
        assertEquals("DC1", ex.getResourceId());
    }

    @Test
    void run_正常ケース_ファイルを指定する_ステージしたコンテナで起動されること() {
        List<Path> files = List.of(Path.of("a.csv"));
        UploadReceipt receipt = new UploadReceipt();
        receipt.setId("F1");
        when(stager.stage(StagingTarget.fileContainer(null), files))
                .thenReturn(new StagingResult(List.of(receipt), "C7"));
        when(http.post(PRISM + "/dataChanges/DC1/activities", "{\"fileContainerWid\":\"C7\"}"))
                .thenReturn(ok(201, "{\"id\":\"A9\"}"));

        DataChangeRun run = service.run("DC1", files);

        assertEquals("C7", run.getFiles().getId());
        assertEquals("A9", run.getActivity().getActivityId());
    }

    @Test
    void run_正常ケース_ステージできたファイルが無い_起動されないこと() {
        when(stager.stage(any(), any()))
                .thenReturn(new StagingResult(Collections.emptyList(), null));

        DataChangeRun run = service.run("DC1", List.of(Path.of("missing.csv")));

        assertNull(run.getActivity());
        verify(http, never()).post(anyString(), any());
    }

    @Test
    void run_正常ケース_ファイルにnullを指定する_コンテナ無しで起動されること() {
        when(http.post(PRISM + "/dataChanges/DC1/activities", null))
                .thenReturn(ok(201, "{\"id\":\"A2\"}"));

        DataChangeRun run = service.run("DC1", null);

        assertNull(run.getFiles());
        assertEquals("A2", run.getActivity().getActivityId());
        verify(stager, never()).stage(any(), any());
    }

    @Test
    void activity_正常ケース_存在しないアクティビティを指定する_空が返ること() {
        when(http.get(PRISM + "/dataChanges/DC1/activities/A1"))
                .thenReturn(ok(200, "{\"id\":\"A1\",\"state\":{\"descriptor\":\"Success\"}}"));
        when(http.get(PRISM + "/dataChanges/DC1/activities/A2")).thenReturn(ok(404, ""));
        assertEquals("Success", service.activity("DC1", "A1").get().getState().getDescriptor());
        assertFalse(service.activity("DC1", "A2").isPresent());
    }
}
