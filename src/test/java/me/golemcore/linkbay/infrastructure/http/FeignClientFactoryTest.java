package me.golemcore.linkbay.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Param;
import feign.RequestLine;
import me.golemcore.linkbay.infrastructure.config.LinkbayProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeignClientFactoryTest {

    interface EchoApi {
        @RequestLine("GET /echo?text={text}")
        String echo(@Param("text") String text);
    }

    @Test
    void create_buildsProxyForApiInterface() {
        FeignClientFactory factory = new FeignClientFactory(new OkHttpClient(), new ObjectMapper());

        EchoApi api = factory.create(EchoApi.class, "https://echo.example.com");

        assertNotNull(api);
        assertTrue(api.toString().contains("https://echo.example.com"));
    }

    @Test
    void okHttpClient_usesConfiguredTimeouts() {
        LinkbayProperties.HttpProperties http = new LinkbayProperties.HttpProperties();
        http.setConnectTimeout(2000);
        http.setReadTimeout(7000);

        OkHttpClient client = OkHttpConfig.build(http);

        assertEquals(2000, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
        assertEquals(30000, client.writeTimeoutMillis());
        assertTrue(client.retryOnConnectionFailure());
    }
}
