package me.golemcore.actions.domain.executor;

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


import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.exception.UnsupportedActionTypeException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps {@code action_type} tags to their {@link ActionExecutor}.
 */
@Component
@Slf4j
public class ActionExecutorRegistry {

    private final Map<String, ActionExecutor> executors;

    public ActionExecutorRegistry(List<ActionExecutor> executors) {
        Map<String, ActionExecutor> byType = new LinkedHashMap<>();
        for (ActionExecutor executor : executors) {
            ActionExecutor previous = byType.putIfAbsent(executor.getActionType(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate executors for action type " + executor.getActionType()
                        + ": " + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        this.executors = Collections.unmodifiableMap(byType);
        log.info("[Executor] Registered action types: {}", this.executors.keySet());
    }

    public Optional<ActionExecutor> find(String actionType) {
        if (actionType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(executors.get(actionType));
    }

    /**
     * @throws UnsupportedActionTypeException
     *             if no executor handles the type
     */
    public ActionExecutor require(String actionType) {
        return find(actionType)
                .orElseThrow(() -> new UnsupportedActionTypeException(actionType, executors.keySet()));
    }

    public Set<String> getSupportedTypes() {
        return executors.keySet();
    }
}
