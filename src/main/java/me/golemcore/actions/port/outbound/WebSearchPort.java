package me.golemcore.actions.port.outbound;

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

import me.golemcore.actions.domain.model.SearchResult;

import java.util.List;

/**
 * Port for a web search provider. Each adapter is selected by its engine id.
 */
public interface WebSearchPort {

    /**
     * Engine id as used in the {@code engine} field of a web search action.
     */
    String getEngineId();

    boolean isAvailable();

    /**
     * Run a query. Failures surface as runtime exceptions.
     */
    List<SearchResult> search(String query, int maxResults);
}
