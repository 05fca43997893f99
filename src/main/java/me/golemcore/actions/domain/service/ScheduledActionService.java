package me.golemcore.actions.domain.service;

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


import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.executor.ActionExecutorRegistry;
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.domain.model.ScheduleType;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionForm;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;
import me.golemcore.actions.domain.model.TimerStatus;
import me.golemcore.actions.domain.scheduler.ActionScheduler;
import me.golemcore.actions.domain.trigger.TriggerCalculator;
import me.golemcore.actions.port.outbound.ScheduledActionPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Management operations on scheduled actions. Every mutation is validated
 * up front and followed by a scheduler reload so timers track the stored
 * definitions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledActionService {

    private final ScheduledActionPort actionPort;
    private final ActionExecutorRegistry executorRegistry;
    private final TriggerCalculator triggerCalculator;
    private final ActionScheduler scheduler;

    public List<ScheduledAction> listByOwner(String owner) {
        return actionPort.findByOwner(owner);
    }

    public List<ScheduledAction> listAll() {
        return actionPort.findAll();
    }

    public Optional<ScheduledAction> find(String id) {
        return actionPort.findById(id);
    }

    /**
     * @throws IllegalArgumentException
     *             if the name is missing or the action type, schedule type or
     *             schedule config is invalid
     */
    public ScheduledAction create(String owner, ScheduledActionForm form) {
        if (form == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (form.getName() == null || form.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        executorRegistry.require(form.getActionType());
        String scheduleType = validateSchedule(form.getScheduleType(), form.getScheduleConfig());

        ScheduledAction action = ScheduledAction.builder()
                .owner(owner)
                .name(form.getName().trim())
                .description(form.getDescription())
                .actionType(form.getActionType())
                .actionConfig(form.getActionConfig() != null ? new LinkedHashMap<>(form.getActionConfig())
                        : new LinkedHashMap<>())
                .scheduleType(scheduleType)
                .scheduleConfig(form.getScheduleConfig() != null ? new LinkedHashMap<>(form.getScheduleConfig())
                        : new LinkedHashMap<>())
                .enabled(form.getEnabled() == null || form.getEnabled())
                .build();

        ScheduledAction created = actionPort.create(action);
        log.info("[Actions] Created {} action '{}' ({}) for {}", created.getActionType(), created.getName(),
                created.getId(), owner);
        scheduler.reload();
        return created;
    }

    /**
     * Apply the non-null fields of {@code update}. A changed schedule is
     * validated against the resulting type and config.
     */
    public Optional<ScheduledAction> update(String id, ScheduledActionUpdate update) {
        Optional<ScheduledAction> existing = actionPort.findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (update == null) {
            return existing;
        }
        if (update.getName() != null && update.getName().isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        ScheduledActionUpdate effective = update;
        if (update.touchesSchedule()) {
            ScheduledAction current = existing.get();
            String type = update.getScheduleType() != null ? update.getScheduleType() : current.getScheduleType();
            Map<String, Object> config = update.getScheduleConfig() != null ? update.getScheduleConfig()
                    : current.getScheduleConfig();
            String normalized = validateSchedule(type, config);
            if (update.getScheduleType() != null) {
                effective = update.toBuilder().scheduleType(normalized).build();
            }
        }

        Optional<ScheduledAction> updated = actionPort.update(id, effective);
        updated.ifPresent(action -> {
            log.info("[Actions] Updated action '{}' ({})", action.getName(), id);
            scheduler.reload();
        });
        return updated;
    }

    public Optional<ScheduledAction> toggle(String id, boolean enabled) {
        Optional<ScheduledAction> updated = actionPort.update(id, ScheduledActionUpdate.enabled(enabled));
        updated.ifPresent(action -> {
            log.info("[Actions] Action '{}' ({}) {}", action.getName(), id, enabled ? "enabled" : "disabled");
            scheduler.reload();
        });
        return updated;
    }

    public boolean delete(String id) {
        boolean deleted = actionPort.delete(id);
        if (deleted) {
            log.info("[Actions] Deleted action {}", id);
            scheduler.reload();
        }
        return deleted;
    }

    /**
     * Remove every action owned by {@code owner}, e.g. when the user goes away.
     */
    public int deleteByOwner(String owner) {
        int deleted = actionPort.deleteByOwner(owner);
        if (deleted > 0) {
            log.info("[Actions] Deleted {} actions of {}", deleted, owner);
            scheduler.reload();
        }
        return deleted;
    }

    /**
     * Run the action immediately. Enabled state and one-time semantics are left
     * untouched.
     */
    public ActionResult test(ScheduledAction action) {
        return scheduler.executeNow(action);
    }

    public Optional<TimerStatus> status(String id) {
        return scheduler.status(id);
    }

    private String validateSchedule(String scheduleType, Map<String, Object> scheduleConfig) {
        ScheduleType type = ScheduleType.fromValue(scheduleType);
        triggerCalculator.calculate(type, scheduleConfig);
        return type.getValue();
    }
}
