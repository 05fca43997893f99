package me.golemcore.actions.adapter.outbound.storage;

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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.exception.ActionStorageException;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.MemoryPort;
import me.golemcore.actions.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Appends memory notes to {@code memory/<owner>.jsonl}, one JSON object per
 * line: {@code {id, content, createdAt}}.
 */
@Component
@Slf4j
public class JsonlMemoryAdapter implements MemoryPort {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    public JsonlMemoryAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            ActionsProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getMemory();
    }

    @Override
    public void remember(String owner, String content) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", UUID.randomUUID().toString());
        entry.put("content", content);
        entry.put("createdAt", clock.instant().getEpochSecond());
        try {
            String line = objectMapper.writeValueAsString(entry) + "\n";
            storagePort.appendText(directory, JsonConversationAdapter.ownerSegment(owner) + ".jsonl", line).join();
            log.debug("[Storage] Saved memory note for {}", owner);
        } catch (JsonProcessingException e) {
            throw new ActionStorageException("Failed to serialize memory note", e);
        } catch (CompletionException e) {
            throw new ActionStorageException("Failed to save memory note for " + owner,
                    e.getCause() != null ? e.getCause() : e);
        }
    }
}
