package io.github.yok.prismlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class PrismEndpointsTest {

    private static PrismEndpoints endpoints(String baseUrl, String tenant) {
        PrismConfig config = new PrismConfig();
        config.setBaseUrl(baseUrl);
        config.setTenantName(tenant);
        return new PrismEndpoints(config);
    }

    @Test
    void token_正常ケース_末尾スラッシュありを指定する_トークンURLが返ること() {
        assertEquals("https://prism.example.com/ccx/oauth2/acme/token",
                endpoints("https://prism.example.com/", "acme").token());
    }

    @Test
    void prism_正常ケース_パスを指定する_RESTURLが返ること() {
        assertEquals("https://prism.example.com/api/prismAnalytics/v3/acme/tables",
                endpoints("https://prism.example.com", "acme").prism("/tables"));
    }

    @Test
    void wql_正常ケース_設定済みを指定する_WQLURLが返ること() {
        assertEquals("https://prism.example.com/api/wql/v1/acme",
                endpoints("https://prism.example.com", "acme").wql());
    }

    @Test
    void prism_異常ケース_baseUrl未設定を指定する_IllegalStateExceptionが送出されること() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> endpoints(null, "acme").prism());
        assertTrue(ex.getMessage().contains("prism.base-url"));
    }

    @Test
    void token_異常ケース_tenantName空文字を指定する_IllegalStateExceptionが送出されること() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> endpoints("https://prism.example.com", " ").token());
        assertTrue(ex.getMessage().contains("prism.tenant-name"));
    }
}
