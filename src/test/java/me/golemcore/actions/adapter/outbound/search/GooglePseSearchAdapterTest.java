package me.golemcore.actions.adapter.outbound.search;

import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.config.AutoConfiguration;
import me.golemcore.actions.infrastructure.http.FeignClientFactory;
import me.golemcore.actions.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GooglePseSearchAdapterTest {

    private OkHttpMockEngine engine;
    private ActionsProperties properties;
    private GooglePseSearchAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new ActionsProperties();
        properties.getSearch().getGooglePse().setApiKey("pse-key");
        properties.getSearch().getGooglePse().setEngineId("cx-123");
        properties.getSearch().getGooglePse().setBaseUrl("http://google.test");
        adapter = newAdapter();
        adapter.init();
    }

    @Test
    void shouldSendKeyEngineAndQuery() {
        engine.enqueueJson(200, """
                {"kind": "customsearch#search", "items": [
                  {"title": "One", "link": "https://one.test", "snippet": "first"},
                  {"title": "Two", "link": "https://two.test", "snippet": "second"}
                ]}
                """);

        List<SearchResult> results = adapter.search("java records", 5);

        assertEquals(List.of("One", "Two"), results.stream().map(SearchResult::getTitle).toList());
        assertEquals("https://two.test", results.get(1).getLink());
        assertEquals("first", results.get(0).getSnippet());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/customsearch/v1", request.path());
        assertEquals("pse-key", request.queryParameter("key"));
        assertEquals("cx-123", request.queryParameter("cx"));
        assertEquals("java records", request.queryParameter("q"));
        assertEquals("5", request.queryParameter("num"));
        assertEquals("1", request.queryParameter("start"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldPageBeyondTenResults() {
        engine.enqueueJson(200, page(1, 10));
        engine.enqueueJson(200, page(11, 2));

        List<SearchResult> results = adapter.search("java", 12);

        assertEquals(12, results.size());
        assertEquals("Result 12", results.get(11).getTitle());
        OkHttpMockEngine.CapturedRequest first = engine.takeRequest();
        assertEquals("10", first.queryParameter("num"));
        assertEquals("1", first.queryParameter("start"));
        OkHttpMockEngine.CapturedRequest second = engine.takeRequest();
        assertEquals("2", second.queryParameter("num"));
        assertEquals("11", second.queryParameter("start"));
    }

    @Test
    void shouldStopPagingWhenResultsRunOut() {
        engine.enqueueJson(200, page(1, 4));

        List<SearchResult> results = adapter.search("java", 30);

        assertEquals(4, results.size());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldReturnEmptyWithoutItems() {
        engine.enqueueJson(200, "{\"kind\": \"customsearch#search\"}");

        assertTrue(adapter.search("nothing", 5).isEmpty());
    }

    @Test
    void shouldWrapHttpErrors() {
        engine.enqueueJson(403, "{\"error\": {\"code\": 403}}");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> adapter.search("java", 5));
        assertEquals("Google PSE error (status 403)", e.getMessage());
    }

    @Test
    void shouldBeUnavailableWithoutEngineId() {
        properties.getSearch().getGooglePse().setEngineId("");
        GooglePseSearchAdapter unconfigured = newAdapter();
        unconfigured.init();

        assertFalse(unconfigured.isAvailable());
        assertEquals("google_pse", unconfigured.getEngineId());
        assertThrows(IllegalStateException.class, () -> unconfigured.search("java", 5));
    }

    private GooglePseSearchAdapter newAdapter() {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        return new GooglePseSearchAdapter(new FeignClientFactory(client, AutoConfiguration.objectMapper()),
                properties);
    }

    private static String page(int from, int count) {
        StringBuilder sb = new StringBuilder("{\"items\": [");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            int n = from + i;
            sb.append("{\"title\": \"Result ").append(n).append("\", \"link\": \"https://r").append(n)
                    .append(".test\", \"snippet\": \"s\"}");
        }
        return sb.append("]}").toString();
    }
}
