package io.github.yok.prismlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.prismlink.config.PrismClientConfiguration;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.UploadReceipt;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FileContainerServiceTest {

    private static final String CONTAINERS =
            "https://prism.example.com/api/prismAnalytics/v3/acme/fileContainers";

    private PrismHttpClient http;

    private FileContainerService service;

    @BeforeEach
    void setUp() {
        PrismConfig config = new PrismConfig();
        config.setBaseUrl("https://prism.example.com/");
        config.setTenantName("acme");
        http = mock(PrismHttpClient.class);
        service = new FileContainerService(http, PrismClientConfiguration.newObjectMapper(),
                new PrismEndpoints(config));
    }

    @Test
    void create_正常ケース_201が返る_コンテナIDが返ること() {
        when(http.post(CONTAINERS, null)).thenReturn(new HttpResult(201, "{\"id\":\"C1\"}", ""));
        assertEquals("C1", service.create().getId());
    }

    @Test
    void create_異常ケース_403が返る_CONTAINER_CREATE_FAILEDが送出されること() {
        when(http.post(CONTAINERS, null)).thenReturn(new HttpResult(403, "", "Forbidden"));
        PrismException ex = assertThrows(PrismException.class, () -> service.create());
        assertEquals(ErrorKind.CONTAINER_CREATE_FAILED, ex.getKind());
    }

    @Test
    void files_正常ケース_ファイル一覧が返る_件数と内容が返ること() {
        when(http.get(CONTAINERS + "/C1/files")).thenReturn(new HttpResult(200,
                "[{\"id\":\"F1\",\"name\":\"a.csv.gz\",\"fileLength\":42},"
                        + "{\"id\":\"F2\",\"name\":\"b.csv.gz\"}]",
                ""));
        PagedResult<UploadReceipt> files = service.files("C1");
        assertEquals(2, files.getTotal());
        assertEquals(42L, files.first().getFileLength());
    }

    @Test
    void files_異常ケース_404が返る_空の結果となること() {
        when(http.get(CONTAINERS + "/C0/files")).thenReturn(new HttpResult(404, "", ""));
        when(http.get(CONTAINERS + "/C2/files")).thenReturn(new HttpResult(200, "{", ""));
        assertTrue(service.files("C0").isEmpty());
        assertTrue(service.files("C2").isEmpty());
    }
}
