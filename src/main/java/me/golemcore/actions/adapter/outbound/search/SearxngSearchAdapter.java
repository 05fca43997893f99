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
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.model.SearchResult;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.http.FeignClientFactory;
import me.golemcore.actions.port.outbound.WebSearchPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Web search against a self-hosted SearXNG instance
 * ({@code actions.search.searxng.base-url}) using its JSON output format.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearxngSearchAdapter implements WebSearchPort {

    public static final String ENGINE_ID = "searxng";

    private final FeignClientFactory feignClientFactory;
    private final ActionsProperties properties;

    private SearxngApi searchApi;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getSearch().getSearxng().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("[Searxng] Base URL not configured, engine unavailable");
            return;
        }
        this.searchApi = feignClientFactory.create(SearxngApi.class, stripTrailingSlash(baseUrl.trim()));
        log.info("[Searxng] Initialized at {}", baseUrl);
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
            throw new IllegalStateException("SearXNG query URL not configured");
        }
        SearxngResponse response;
        try {
            response = searchApi.search(query);
        } catch (FeignException e) {
            throw new IllegalStateException("SearXNG error (status " + e.status() + ")", e);
        }
        if (response == null || response.getResults() == null) {
            return List.of();
        }
        return response.getResults().stream()
                .limit(Math.max(1, maxResults))
                .map(r -> SearchResult.builder()
                        .title(r.getTitle())
                        .link(r.getUrl())
                        .snippet(r.getContent())
                        .build())
                .toList();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    interface SearxngApi {
        @RequestLine("GET /search?q={query}&format=json")
        @Headers("Accept: application/json")
        SearxngResponse search(@Param("query") String query);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearxngResponse {
        private List<SearxngResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearxngResult {
        private String title;
        private String url;
        private String content;
    }
}
