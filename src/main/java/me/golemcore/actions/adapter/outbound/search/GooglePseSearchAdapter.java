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

import java.util.ArrayList;
import java.util.List;

/**
 * Web search through a Google Programmable Search Engine. Needs both
 * {@code actions.search.google-pse.api-key} and
 * {@code actions.search.google-pse.engine-id}.
 *
 * <p>
 * The Custom Search API returns at most 10 items per call and 100 per query,
 * so larger requests are paged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GooglePseSearchAdapter implements WebSearchPort {

    public static final String ENGINE_ID = "google_pse";

    static final int PAGE_SIZE = 10;
    static final int MAX_TOTAL = 100;

    private final FeignClientFactory feignClientFactory;
    private final ActionsProperties properties;

    private GooglePseApi searchApi;
    private String apiKey;
    private String engineId;

    @PostConstruct
    public void init() {
        ActionsProperties.GooglePseProperties config = properties.getSearch().getGooglePse();
        if (isBlank(config.getApiKey()) || isBlank(config.getEngineId())) {
            log.info("[GooglePse] API key or engine ID not configured, engine unavailable");
            return;
        }
        this.apiKey = config.getApiKey().trim();
        this.engineId = config.getEngineId().trim();
        this.searchApi = feignClientFactory.create(GooglePseApi.class, config.getBaseUrl());
        log.info("[GooglePse] Initialized");
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
            throw new IllegalStateException("Google PSE API key or engine ID not configured");
        }
        int wanted = Math.min(MAX_TOTAL, Math.max(1, maxResults));
        List<SearchResult> results = new ArrayList<>();
        int start = 1;
        while (results.size() < wanted) {
            int num = Math.min(PAGE_SIZE, wanted - results.size());
            GooglePseResponse response;
            try {
                response = searchApi.search(apiKey, engineId, query, num, start);
            } catch (FeignException e) {
                throw new IllegalStateException("Google PSE error (status " + e.status() + ")", e);
            }
            if (response == null || response.getItems() == null || response.getItems().isEmpty()) {
                break;
            }
            for (GooglePseItem item : response.getItems()) {
                if (results.size() >= wanted) {
                    break;
                }
                results.add(SearchResult.builder()
                        .title(item.getTitle())
                        .link(item.getLink())
                        .snippet(item.getSnippet())
                        .build());
            }
            if (response.getItems().size() < num) {
                break;
            }
            start += num;
        }
        return results;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    interface GooglePseApi {
        @RequestLine("GET /customsearch/v1?key={key}&cx={cx}&q={query}&num={num}&start={start}")
        @Headers("Accept: application/json")
        GooglePseResponse search(@Param("key") String key, @Param("cx") String cx, @Param("query") String query,
                @Param("num") int num, @Param("start") int start);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GooglePseResponse {
        private List<GooglePseItem> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GooglePseItem {
        private String title;
        private String link;
        private String snippet;
    }
}
