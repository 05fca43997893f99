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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.exception.ActionStorageException;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.ScheduledActionPort;
import me.golemcore.actions.port.outbound.StoragePort;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@link ScheduledActionPort} backed by a single JSON document,
 * {@code actions/scheduled-actions.json}.
 *
 * <p>
 * The document is loaded once and cached. Mutations are applied to a copy,
 * written atomically (keeping a {@code .bak}), and only then become visible.
 * Callers always receive detached copies.
 */
@Repository
@Slf4j
public class JsonScheduledActionRepository implements ScheduledActionPort {

    static final String ACTIONS_FILE = "scheduled-actions.json";

    private static final TypeReference<List<ScheduledAction>> ACTION_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private List<ScheduledAction> cache;

    public JsonScheduledActionRepository(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            ActionsProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getActions();
    }

    @Override
    public synchronized ScheduledAction create(ScheduledAction action) {
        long now = clock.instant().getEpochSecond();
        ScheduledAction entry = action.copy();
        entry.setId(UUID.randomUUID().toString());
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);

        List<ScheduledAction> updated = working();
        updated.add(entry);
        save(updated);
        log.debug("[Storage] Created action {}", entry.getId());
        return entry.copy();
    }

    @Override
    public synchronized List<ScheduledAction> findAll() {
        return select(a -> true);
    }

    @Override
    public synchronized List<ScheduledAction> findByOwner(String owner) {
        return select(a -> Objects.equals(a.getOwner(), owner));
    }

    @Override
    public synchronized List<ScheduledAction> findEnabled() {
        return select(ScheduledAction::isEnabled);
    }

    @Override
    public synchronized Optional<ScheduledAction> findById(String id) {
        return actions().stream()
                .filter(a -> a.getId().equals(id))
                .findFirst()
                .map(ScheduledAction::copy);
    }

    @Override
    public synchronized Optional<ScheduledAction> update(String id, ScheduledActionUpdate update) {
        return modify(id, action -> {
            if (update.getName() != null) {
                action.setName(update.getName());
            }
            if (update.getDescription() != null) {
                action.setDescription(update.getDescription());
            }
            if (update.getActionConfig() != null) {
                action.setActionConfig(new LinkedHashMap<>(update.getActionConfig()));
            }
            if (update.getScheduleType() != null) {
                action.setScheduleType(update.getScheduleType());
            }
            if (update.getScheduleConfig() != null) {
                action.setScheduleConfig(new LinkedHashMap<>(update.getScheduleConfig()));
            }
            if (update.getEnabled() != null) {
                action.setEnabled(update.getEnabled());
            }
        });
    }

    @Override
    public synchronized boolean updateRunTimes(String id, Long lastRunAt, Long nextRunAt) {
        return modify(id, action -> {
            if (lastRunAt != null) {
                action.setLastRunAt(lastRunAt);
            }
            if (nextRunAt != null) {
                action.setNextRunAt(nextRunAt);
            }
        }).isPresent();
    }

    @Override
    public synchronized Optional<ScheduledAction> updateConfig(String id, Map<String, Object> partialConfig) {
        return modify(id, action -> {
            Map<String, Object> merged = action.getActionConfig() != null
                    ? new LinkedHashMap<>(action.getActionConfig())
                    : new LinkedHashMap<>();
            merged.putAll(partialConfig);
            action.setActionConfig(merged);
        });
    }

    @Override
    public synchronized Optional<ScheduledAction> disable(String id) {
        return modify(id, action -> action.setEnabled(false));
    }

    @Override
    public synchronized boolean delete(String id) {
        List<ScheduledAction> updated = working();
        if (!updated.removeIf(a -> a.getId().equals(id))) {
            return false;
        }
        save(updated);
        return true;
    }

    @Override
    public synchronized int deleteByOwner(String owner) {
        List<ScheduledAction> updated = working();
        int before = updated.size();
        updated.removeIf(a -> Objects.equals(a.getOwner(), owner));
        int removed = before - updated.size();
        if (removed > 0) {
            save(updated);
        }
        return removed;
    }

    private List<ScheduledAction> select(Predicate<ScheduledAction> filter) {
        return actions().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(ScheduledAction::getCreatedAt).reversed())
                .map(ScheduledAction::copy)
                .toList();
    }

    private Optional<ScheduledAction> modify(String id, Consumer<ScheduledAction> change) {
        List<ScheduledAction> updated = working();
        for (int i = 0; i < updated.size(); i++) {
            ScheduledAction action = updated.get(i);
            if (action.getId().equals(id)) {
                change.accept(action);
                action.setUpdatedAt(clock.instant().getEpochSecond());
                save(updated);
                return Optional.of(action.copy());
            }
        }
        return Optional.empty();
    }

    private List<ScheduledAction> working() {
        List<ScheduledAction> copy = new ArrayList<>();
        for (ScheduledAction action : actions()) {
            copy.add(action.copy());
        }
        return copy;
    }

    private List<ScheduledAction> actions() {
        if (cache == null) {
            cache = load();
        }
        return cache;
    }

    private void save(List<ScheduledAction> actions) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(actions);
        } catch (JsonProcessingException e) {
            throw new ActionStorageException("Failed to serialize scheduled actions", e);
        }
        try {
            storagePort.putTextAtomic(directory, ACTIONS_FILE, json, true).join();
        } catch (CompletionException e) {
            throw new ActionStorageException("Failed to save scheduled actions", unwrap(e));
        }
        cache = actions;
    }

    private List<ScheduledAction> load() {
        String json;
        try {
            json = storagePort.getText(directory, ACTIONS_FILE).join();
        } catch (CompletionException e) {
            throw new ActionStorageException("Failed to read scheduled actions", unwrap(e));
        }
        if (json == null || json.isBlank()) {
            log.debug("[Storage] No scheduled actions stored yet");
            return new ArrayList<>();
        }
        try {
            List<ScheduledAction> loaded = new ArrayList<>(objectMapper.readValue(json, ACTION_LIST_TYPE_REF));
            log.info("[Storage] Loaded {} scheduled actions", loaded.size());
            return loaded;
        } catch (JsonProcessingException e) {
            throw new ActionStorageException("Corrupt scheduled actions file: " + directory + "/" + ACTIONS_FILE, e);
        }
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
