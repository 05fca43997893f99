package me.golemcore.actions.adapter.outbound.search;

import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.config.AutoConfiguration;
import me.golemcore.actions.infrastructure.http.FeignClientFactory;
import me.golemcore.actions.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BraveSearchAdapterTest {

    private static final String RESPONSE = """
            {"web": {"results": [
              {"title": "OpenJDK 21", "url": "https://openjdk.org/projects/jdk/21/", "description": "GA release"},
              {"title": "Virtual threads", "url": "https://example.com/vt", "description": "Loom", "age": "2d"}
            ]}}
            """;

    private OkHttpMockEngine engine;
    private ActionsProperties properties;
    private FeignClientFactory feignClientFactory;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        feignClientFactory = new FeignClientFactory(client, AutoConfiguration.objectMapper());
        properties = new ActionsProperties();
        properties.getSearch().getBrave().setBaseUrl("http://brave.test");
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        BraveSearchAdapter adapter = createAdapter("");

        assertFalse(adapter.isAvailable());
        assertThrows(IllegalStateException.class, () -> adapter.search("java", 5));
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldSendQueryAndMapResults() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        engine.enqueueJson(200, RESPONSE);

        List<SearchResult> results = adapter.search("java 21", 5);

        assertEquals(2, results.size());
        assertEquals("OpenJDK 21", results.get(0).getTitle());
        assertEquals("https://openjdk.org/projects/jdk/21/", results.get(0).getLink());
        assertEquals("GA release", results.get(0).getSnippet());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/res/v1/web/search", request.path());
        assertEquals("java 21", request.queryParameter("q"));
        assertEquals("5", request.queryParameter("count"));
        assertEquals("brave-key", request.header("X-Subscription-Token"));
    }

    @Test
    void shouldCapCountAtApiLimit() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        engine.enqueueJson(200, "{}");

        assertTrue(adapter.search("java", 50).isEmpty());
        assertEquals("20", engine.takeRequest().queryParameter("count"));
    }

    @Test
    void shouldRetryOnRateLimit() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(200, RESPONSE);

        List<SearchResult> results = adapter.search("java", 5);

        assertEquals(2, results.size());
        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        for (int i = 0; i < 4; i++) {
            engine.enqueueJson(429, "{}");
        }

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> adapter.search("java", 5));

        assertEquals("Brave Search rate limit exceeded", e.getMessage());
        assertEquals(4, engine.getRequestCount());
    }

    @Test
    void shouldNotRetryOtherErrors() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        engine.enqueueJson(401, "{\"error\": \"bad token\"}");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> adapter.search("java", 5));

        assertTrue(e.getMessage().contains("401"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldReportTransportFailure() {
        BraveSearchAdapter adapter = createAdapter("brave-key");
        engine.enqueueFailure(new IOException("connection reset"));

        assertThrows(IllegalStateException.class, () -> adapter.search("java", 5));
    }

    private BraveSearchAdapter createAdapter(String apiKey) {
        properties.getSearch().getBrave().setApiKey(apiKey);
        BraveSearchAdapter adapter = new BraveSearchAdapter(feignClientFactory, properties);
        adapter.setInitialBackoffMs(1);
        adapter.init();
        return adapter;
    }
}
