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

import me.golemcore.actions.domain.model.LlmRequest;
import me.golemcore.actions.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers (OpenAI, Anthropic, etc.).
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the model used when a request does not name one.
     */
    String getDefaultModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
