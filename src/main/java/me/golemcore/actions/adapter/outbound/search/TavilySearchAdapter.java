package me.golemcore.actions.adapter.outbound.search;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.http.FeignClientFactory;
import me.golemcore.actions.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Web search through the Tavily API. The key from
 * {@code actions.search.tavily.api-key} is sent as a bearer token.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TavilySearchAdapter implements WebSearchPort {

    public static final String ENGINE_ID = "tavily";

    private final FeignClientFactory feignClientFactory;
    private final ActionsProperties properties;

    private TavilyApi searchApi;

    @PostConstruct
    public void init() {
        ActionsProperties.TavilyProperties config = properties.getSearch().getTavily();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.info("[Tavily] API key not configured, engine unavailable");
            return;
        }
        this.searchApi = feignClientFactory.create(TavilyApi.class, config.getBaseUrl(),
                template -> template.header("Authorization", "Bearer " + apiKey));
        log.info("[Tavily] Initialized");
    }

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public boolean isAvailable() {
        return searchApi != null;
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        if (searchApi == null) {
            throw new IllegalStateException("Tavily API key not configured");
        }
        TavilyResponse response;
        try {
            response = searchApi.search(new TavilyRequest(query, Math.max(1, maxResults)));
        } catch (FeignException e) {
            throw new IllegalStateException("Tavily API error (status " + e.status() + ")", e);
        }
        if (response == null || response.getResults() == null) {
            return List.of();
        }
        return response.getResults().stream()
                .map(r -> SearchResult.builder()
                        .title(r.getTitle())
                        .link(r.getUrl())
                        .snippet(r.getContent())
                        .build())
                .toList();
    }

    interface TavilyApi {
        @RequestLine("POST /search")
        @Headers({
                "Accept: application/json",
                "Content-Type: application/json"
        })
        TavilyResponse search(TavilyRequest request);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class TavilyRequest {
        private String query;
        @JsonProperty("max_results")
        private int maxResults;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TavilyResponse {
        private List<TavilyResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TavilyResult {
        private String title;
        private String url;
        private String content;
    }
}
