package io.github.yok.prismlink.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.prismlink.config.PrismClientConfiguration;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.http.UploadFile;
import io.github.yok.prismlink.model.FileContainer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class FileStagerTest {

    private static final String PRISM = "https://prism.example.com/api/prismAnalytics/v3/acme";

    @TempDir
    Path tempDir;

    private PrismHttpClient http;

    private FileContainerService containers;

    private FileStager stager;

    @BeforeEach
    void setUp() {
        PrismConfig config = new PrismConfig();
        config.setBaseUrl("https://prism.example.com");
        config.setTenantName("acme");
        http = mock(PrismHttpClient.class);
        containers = mock(FileContainerService.class);
        stager = new FileStager(http, PrismClientConfiguration.newObjectMapper(),
                new PrismEndpoints(config), containers);
        when(http.postFile(anyString(), any(UploadFile.class))).thenAnswer(inv -> {
            UploadFile file = inv.getArgument(1);
            return new HttpResult(201, "{\"id\":\"F-" + file.getFileName() + "\",\"name\":\""
                    + file.getFileName() + "\"}", "Created");
        });
    }

    private static byte[] gunzip(byte[] content) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return in.readAllBytes();
        }
    }

    private List<UploadFile> uploadedTo(String url, int count) {
        ArgumentCaptor<UploadFile> files = ArgumentCaptor.forClass(UploadFile.class);
        verify(http, times(count)).postFile(eq(url), files.capture());
        return files.getAllValues();
    }

    @Test
    void stage_正常ケース_csvと存在しないファイルとcsvgzを指定する_2件が受け付けられること()
            throws Exception {
        byte[] csv = "id,name\n1,Tokyo\n".getBytes(StandardCharsets.UTF_8);
        Path a = Files.write(tempDir.resolve("a.csv"), csv);
        Path missing = tempDir.resolve("missing.csv");
        Path b = Files.write(tempDir.resolve("b.csv.gz"), FileStager.gzip(csv));

        StagingResult result =
                stager.stage(StagingTarget.bucket("B1"), Arrays.asList(a, missing, b));

        assertEquals(2, result.getTotal());
        assertEquals("B1", result.getId());
        assertEquals("F-a.csv.gz", result.getData().get(0).getId());
        List<UploadFile> uploads = uploadedTo(PRISM + "/buckets/B1/files", 2);
        assertEquals("a.csv.gz", uploads.get(0).getFileName());
        assertFalse(uploads.get(0).isStreamed());
        assertArrayEquals(csv, gunzip(uploads.get(0).getContent()));
        assertEquals("b.csv.gz", uploads.get(1).getFileName());
        assertTrue(uploads.get(1).isStreamed());
        assertEquals(b, uploads.get(1).getPath());
    }

    @Test
    void stage_正常ケース_対象外の拡張子を指定する_スキップされること() throws Exception {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");
        Path upper = Files.writeString(tempDir.resolve("DATA.CSV"), "x\n1\n");

        StagingResult result = stager.stage(StagingTarget.bucket("B1"), List.of(text, upper));

        assertEquals(1, result.getTotal());
        assertEquals("DATA.CSV.gz", uploadedTo(PRISM + "/buckets/B1/files", 1).get(0)
                .getFileName());
    }

    @Test
    void stage_正常ケース_nullを指定する_空の圧縮ファイルが1件アップロードされること()
            throws Exception {
        StagingResult result = stager.stage(StagingTarget.bucket("B1"), null);

        assertEquals(1, result.getTotal());
        UploadFile upload = uploadedTo(PRISM + "/buckets/B1/files", 1).get(0);
        assertEquals("empty.csv.gz", upload.getFileName());
        assertEquals(0, gunzip(upload.getContent()).length);
    }

    @Test
    void stage_正常ケース_ID無しのファイルコンテナを指定する_コンテナが1度だけ作成され再利用されること()
            throws Exception {
        FileContainer container = new FileContainer();
        container.setId("C1");
        when(containers.create()).thenReturn(container);
        Path a = Files.writeString(tempDir.resolve("a.csv"), "x\n1\n");
        Path b = Files.writeString(tempDir.resolve("b.csv"), "x\n2\n");

        StagingResult result = stager.stage(StagingTarget.fileContainer(null), List.of(a, b));

        assertEquals("C1", result.getId());
        assertEquals(2, result.getTotal());
        verify(containers, times(1)).create();
        uploadedTo(PRISM + "/fileContainers/C1/files", 2);
    }

    @Test
    void stage_正常ケース_既存のコンテナIDを指定する_コンテナが作成されないこと() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.csv"), "x\n1\n");

        StagingResult result = stager.stage(StagingTarget.fileContainer(" C9 "), List.of(a));

        assertEquals("C9", result.getId());
        verify(containers, never()).create();
        uploadedTo(PRISM + "/fileContainers/C9/files", 1);
    }

    @Test
    void stage_正常ケース_有効なファイルが無い_コンテナが作成されず空の結果となること() {
        StagingResult result = stager.stage(StagingTarget.fileContainer(null),
                List.of(tempDir.resolve("missing.csv")));

        assertTrue(result.isEmpty());
        assertNull(result.getId());
        verify(containers, never()).create();
        verify(http, never()).postFile(anyString(), any(UploadFile.class));
    }

    @Test
    void stage_異常ケース_1件のアップロードが失敗する_残りのファイルは処理されること()
            throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.csv"), "x\n1\n");
        Path b = Files.writeString(tempDir.resolve("b.csv"), "x\n2\n");
        when(http.postFile(anyString(), any(UploadFile.class)))
                .thenReturn(new HttpResult(500, "", "Server Error"))
                .thenReturn(new HttpResult(201, "{\"id\":\"F2\"}", "Created"));

        StagingResult result = stager.stage(StagingTarget.bucket("B1"), List.of(a, b));

        assertEquals(1, result.getTotal());
        assertEquals("F2", result.first().getId());
    }
}
