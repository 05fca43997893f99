package me.golemcore.actions.infrastructure.http;

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


import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.RequestInterceptor;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds declarative Feign clients for the web search providers.
 *
 * <p>
 * Every client shares the pooled OkHttp transport and the application
 * {@link ObjectMapper}. Feign's own retryer is disabled: adapters decide
 * themselves which failures are worth another attempt.
 *
 * <pre>{@code
 * BraveApi api = factory.create(BraveApi.class, "https://api.search.brave.com");
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl) {
        return builder().target(apiType, baseUrl);
    }

    /**
     * Create a client whose every request passes through the given interceptor,
     * e.g. to attach an API key header.
     */
    public <T> T create(Class<T> apiType, String baseUrl, RequestInterceptor interceptor) {
        return builder()
                .requestInterceptor(interceptor)
                .target(apiType, baseUrl);
    }

    private Feign.Builder builder() {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY);
    }
}
