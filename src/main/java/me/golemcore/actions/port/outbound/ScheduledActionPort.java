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

import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for durable storage of scheduled action definitions and their run
 * bookkeeping. Implementations return detached copies and may fail with
 * {@link me.golemcore.actions.domain.exception.ActionStorageException}.
 */
public interface ScheduledActionPort {

    /**
     * Persist a new action. Assigns id and creation timestamps.
     */
    ScheduledAction create(ScheduledAction action);

    List<ScheduledAction> findAll();

    List<ScheduledAction> findByOwner(String owner);

    /**
     * Point-in-time snapshot of every enabled action across all owners.
     */
    List<ScheduledAction> findEnabled();

    Optional<ScheduledAction> findById(String id);

    /**
     * Apply the non-null fields of {@code update}.
     */
    Optional<ScheduledAction> update(String id, ScheduledActionUpdate update);

    /**
     * Record run bookkeeping. Each timestamp is written only when non-null, so a
     * next-run write-back never overwrites a more recent {@code lastRunAt}.
     *
     * @return false if the action does not exist
     */
    boolean updateRunTimes(String id, Long lastRunAt, Long nextRunAt);

    /**
     * Merge {@code partialConfig} into the action's config, keeping every key not
     * mentioned.
     */
    Optional<ScheduledAction> updateConfig(String id, Map<String, Object> partialConfig);

    Optional<ScheduledAction> disable(String id);

    boolean delete(String id);

    int deleteByOwner(String owner);
}
