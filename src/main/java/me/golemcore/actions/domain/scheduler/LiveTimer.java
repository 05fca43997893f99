package me.golemcore.actions.domain.scheduler;

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


import me.golemcore.actions.domain.trigger.ActionTrigger;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory binding of an action id to its trigger and pending dispatch. Never
 * persisted; rebuilt on every reload.
 *
 * <p>
 * {@code nextFireTime} and {@code handle} are only changed under the
 * scheduler's timer lock.
 */
final class LiveTimer {

    private final String actionId;
    private final String actionName;
    private final ActionTrigger trigger;

    private volatile Instant nextFireTime;
    private volatile boolean cancelled;
    private ScheduledFuture<?> handle;

    LiveTimer(String actionId, String actionName, ActionTrigger trigger, Instant nextFireTime) {
        this.actionId = actionId;
        this.actionName = actionName;
        this.trigger = trigger;
        this.nextFireTime = nextFireTime;
    }

    String getActionId() {
        return actionId;
    }

    String getActionName() {
        return actionName;
    }

    ActionTrigger getTrigger() {
        return trigger;
    }

    Instant getNextFireTime() {
        return nextFireTime;
    }

    void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    void setHandle(ScheduledFuture<?> handle) {
        this.handle = handle;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        cancelled = true;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
