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


import lombok.extern.slf4j.Slf4j;
import me.golemcore.actions.domain.executor.ActionExecutor;
import me.golemcore.actions.domain.executor.ActionExecutorRegistry;
import me.golemcore.actions.domain.executor.ConfigValues;
import me.golemcore.actions.domain.executor.NotificationExecutor;
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.domain.model.ActionStatus;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.TimerStatus;
import me.golemcore.actions.domain.trigger.ActionTrigger;
import me.golemcore.actions.domain.trigger.TriggerCalculator;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.ScheduledActionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one live timer per enabled scheduled action and runs the action when
 * its timer fires.
 *
 * <p>
 * Timers are derived state: {@link #reload()} throws the whole set away and
 * rebuilds it from a fresh repository snapshot. A single daemon thread arms and
 * dispatches timers; the actions themselves run on a worker pool so a slow
 * search or LLM call never delays other timers.
 *
 * <p>
 * On every fire the action is re-read from the repository, so deletes and
 * disables made after the last reload are honored. Run bookkeeping
 * ({@code last_run_at}, {@code next_run_at}, one-shot disable) is written back
 * best-effort; the in-memory timer stays authoritative.
 *
 * <p>
 * Per-action failures (bad schedule, executor error, storage error) are logged
 * and contained; they never escape a fire or a reload.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ActionScheduler {

    private final ScheduledActionPort actionPort;
    private final ActionExecutorRegistry executorRegistry;
    private final TriggerCalculator triggerCalculator;
    private final ActionsProperties properties;
    private final Clock clock;

    private final Map<String, LiveTimer> timers = new ConcurrentHashMap<>();
    // Ids with a run in progress; survives reloads.
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Object timerLock = new Object();
    private final AtomicLong reloadSequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long appliedReload;

    private ScheduledThreadPoolExecutor dispatcher;
    private ExecutorService workers;

    public ActionScheduler(ScheduledActionPort actionPort, ActionExecutorRegistry executorRegistry,
            TriggerCalculator triggerCalculator, ActionsProperties properties, Clock clock) {
        this.actionPort = actionPort;
        this.executorRegistry = executorRegistry;
        this.triggerCalculator = triggerCalculator;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Arm timers for every enabled action and begin dispatching. No-op if already
     * running.
     */
    public synchronized void start() {
        if (running.get()) {
            log.debug("[Scheduler] Already running");
            return;
        }
        dispatcher = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "action-scheduler");
            t.setDaemon(true);
            return t;
        });
        dispatcher.setRemoveOnCancelPolicy(true);
        dispatcher.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "action-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running.set(true);
        log.info("[Scheduler] Started (misfire grace: {}, zone: {})",
                properties.getScheduler().getMisfireGraceTime(), triggerCalculator.getZone());
        reload();
    }

    /**
     * Disarm all timers and wait for in-flight fires to finish, up to the
     * configured shutdown timeout. No-op if not running.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (timerLock) {
            timers.values().forEach(LiveTimer::cancel);
            timers.clear();
        }
        dispatcher.shutdown();
        workers.shutdown();
        Duration timeout = properties.getScheduler().getShutdownTimeout();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Scheduler] In-flight actions did not finish within {}, interrupting", timeout);
                workers.shutdownNow();
            }
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== RECONCILIATION ====================

    /**
     * Replace the live timer set with one derived from the currently enabled
     * actions. Safe to call concurrently with itself and with running fires; when
     * reloads overlap, the one that started last wins.
     */
    public void reload() {
        if (!running.get()) {
            log.debug("[Scheduler] Not running, reload skipped");
            return;
        }
        long sequence = reloadSequence.incrementAndGet();

        List<ScheduledAction> actions;
        try {
            actions = actionPort.findEnabled();
        } catch (RuntimeException e) {
            log.error("[Scheduler] Reload failed, keeping {} current timers: {}", timers.size(), e.getMessage(), e);
            return;
        }

        Instant now = clock.instant();
        Map<String, LiveTimer> fresh = new LinkedHashMap<>();
        for (ScheduledAction action : actions) {
            if (!action.isEnabled() || action.getId() == null) {
                continue;
            }
            LiveTimer timer = createTimer(action, now);
            if (timer != null) {
                fresh.put(action.getId(), timer);
            }
        }

        synchronized (timerLock) {
            if (!running.get()) {
                return;
            }
            if (sequence < appliedReload) {
                log.debug("[Scheduler] Reload #{} superseded by #{}", sequence, appliedReload);
                return;
            }
            appliedReload = sequence;
            timers.values().forEach(LiveTimer::cancel);
            timers.clear();
            timers.putAll(fresh);
            fresh.values().forEach(this::arm);
        }
        log.info("[Scheduler] Reloaded: {} timers armed for {} enabled actions", fresh.size(), actions.size());

        for (LiveTimer timer : fresh.values()) {
            writeNextRunAt(timer);
        }
    }

    private LiveTimer createTimer(ScheduledAction action, Instant now) {
        try {
            ActionTrigger trigger = triggerCalculator.calculate(action.getScheduleType(), action.getScheduleConfig());
            Instant first = trigger.firstFireTime(now);
            if (first == null) {
                log.info("[Scheduler] Action '{}' ({}) has no upcoming fire time", action.getName(), action.getId());
                return null;
            }
            log.debug("[Scheduler] Action '{}' ({}) next run: {}", action.getName(), action.getId(), first);
            return new LiveTimer(action.getId(), action.getName(), trigger, first);
        } catch (IllegalArgumentException e) {
            log.warn("[Scheduler] Skipping action '{}' ({}): {}", action.getName(), action.getId(), e.getMessage());
            return null;
        }
    }

    private void writeNextRunAt(LiveTimer timer) {
        Instant next = timer.getNextFireTime();
        if (next == null || timer.isCancelled()) {
            return;
        }
        try {
            actionPort.updateRunTimes(timer.getActionId(), null, next.getEpochSecond());
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Could not record next run for {}: {}", timer.getActionId(), e.getMessage());
        }
    }

    // ==================== DISPATCH ====================

    // Caller holds timerLock.
    private void arm(LiveTimer timer) {
        long delay = Math.max(0, Duration.between(clock.instant(), timer.getNextFireTime()).toMillis());
        timer.setHandle(dispatcher.schedule(() -> dispatch(timer), delay, TimeUnit.MILLISECONDS));
    }

    private void dispatch(LiveTimer timer) {
        String actionId = timer.getActionId();
        try {
            synchronized (timerLock) {
                if (!running.get() || timer.isCancelled() || timers.get(actionId) != timer) {
                    return;
                }
                Instant scheduled = timer.getNextFireTime();
                Instant now = clock.instant();
                Instant following = timer.getTrigger().nextFireTime(scheduled, now);
                if (following != null) {
                    timer.setNextFireTime(following);
                    arm(timer);
                } else {
                    timer.setNextFireTime(null);
                    timers.remove(actionId, timer);
                }

                Duration lateness = Duration.between(scheduled, now);
                Duration grace = properties.getScheduler().getMisfireGraceTime();
                if (lateness.compareTo(grace) > 0) {
                    log.warn("[Scheduler] Run of {} scheduled at {} was missed by {}", actionId, scheduled, lateness);
                    return;
                }
                if (!inFlight.add(actionId)) {
                    log.warn("[Scheduler] Previous run of {} still in progress, skipping {}", actionId, scheduled);
                    return;
                }
                try {
                    workers.execute(() -> {
                        try {
                            runFire(actionId, timer);
                        } finally {
                            inFlight.remove(actionId);
                        }
                    });
                } catch (RejectedExecutionException e) {
                    inFlight.remove(actionId);
                    log.warn("[Scheduler] Worker pool rejected run of {}", actionId);
                }
            }
        } catch (Exception e) { // NOSONAR - dispatch must never kill the dispatcher thread
            log.error("[Scheduler] Dispatch failed for {}", actionId, e);
        }
    }

    /**
     * Run the fire path for {@code actionId} on the calling thread, as if its
     * timer had just fired.
     */
    Optional<ActionResult> fire(String actionId) {
        return runFire(actionId, timers.get(actionId));
    }

    private Optional<ActionResult> runFire(String actionId, LiveTimer timer) {
        try {
            Optional<ScheduledAction> current;
            try {
                current = actionPort.findById(actionId);
            } catch (RuntimeException e) {
                log.error("[Scheduler] Could not load action {}, skipping run: {}", actionId, e.getMessage());
                return Optional.empty();
            }
            if (current.isEmpty()) {
                log.info("[Scheduler] Action {} no longer exists, removing its timer", actionId);
                removeTimer(actionId, timer);
                return Optional.empty();
            }
            ScheduledAction action = current.get();
            if (!action.isEnabled()) {
                log.info("[Scheduler] Action '{}' ({}) is disabled, skipping run", action.getName(), actionId);
                return Optional.empty();
            }

            log.info("[Scheduler] Running action '{}' ({})", action.getName(), actionId);
            ActionResult result = execute(action);
            log.info("[Scheduler] Action '{}' ({}) finished: {}", action.getName(), actionId,
                    result.isSuccess() ? "success" : result.getMessage());

            recordRun(action);
            if (action.isOneShot()) {
                disableOneShot(actionId);
                removeTimer(actionId, timers.get(actionId));
            }
            return Optional.of(result);
        } catch (Exception e) { // NOSONAR - last-resort guard around a single run
            log.error("[Scheduler] Run of {} failed", actionId, e);
            return Optional.empty();
        }
    }

    private void removeTimer(String actionId, LiveTimer timer) {
        if (timer == null) {
            return;
        }
        synchronized (timerLock) {
            if (timers.remove(actionId, timer)) {
                timer.cancel();
            }
        }
    }

    private void recordRun(ScheduledAction action) {
        Long next = nextFireEpochSecond(action.getId());
        try {
            actionPort.updateRunTimes(action.getId(), clock.instant().getEpochSecond(), next);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Could not record run of {}: {}", action.getId(), e.getMessage());
        }
    }

    private void disableOneShot(String actionId) {
        try {
            actionPort.disable(actionId);
            log.info("[Scheduler] One-time action {} disabled", actionId);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Could not disable one-time action {}: {}", actionId, e.getMessage());
        }
    }

    private Long nextFireEpochSecond(String actionId) {
        LiveTimer timer = timers.get(actionId);
        if (timer == null || timer.isCancelled()) {
            return null;
        }
        Instant next = timer.getNextFireTime();
        return next != null ? next.getEpochSecond() : null;
    }

    // ==================== EXECUTION ====================

    /**
     * Execute {@code action} through its registered executor. Never throws: every
     * failure comes back as an error result.
     */
    public ActionResult execute(ScheduledAction action) {
        try {
            Optional<ActionExecutor> executor = executorRegistry.find(action.getActionType());
            if (executor.isEmpty()) {
                log.error("[Scheduler] No executor for action type '{}' ({})", action.getActionType(), action.getId());
                return ActionResult.error("No executor found for action type: " + action.getActionType());
            }
            Map<String, Object> config = action.getActionConfig() != null
                    ? new LinkedHashMap<>(action.getActionConfig())
                    : new LinkedHashMap<>();

            ActionResult result = executor.get().execute(action.getOwner(), config);
            if (result == null) {
                result = ActionResult.error("Executor returned no result");
            }

            persistConversationId(action, config, result);
            if (ConfigValues.getBoolean(config, "notify", false)) {
                sendCompletionNotification(action, result);
            }
            return result;
        } catch (Exception e) { // NOSONAR - executor failures are reported as data
            log.error("[Scheduler] Action {} failed", action.getId(), e);
            return ActionResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Run {@code action} now, outside its timer, and record {@code last_run_at}.
     * The action stays enabled.
     */
    public ActionResult executeNow(ScheduledAction action) {
        return executeNow(action, false);
    }

    /**
     * @param applyOneShot
     *            disable a one-time action afterwards, as a timer fire would
     */
    public ActionResult executeNow(ScheduledAction action, boolean applyOneShot) {
        log.info("[Scheduler] Manual run of '{}' ({})", action.getName(), action.getId());
        ActionResult result = execute(action);
        if (action.getId() != null) {
            recordRun(action);
            if (applyOneShot && action.isOneShot()) {
                disableOneShot(action.getId());
                removeTimer(action.getId(), timers.get(action.getId()));
            }
        }
        return result;
    }

    private void persistConversationId(ScheduledAction action, Map<String, Object> config, ActionResult result) {
        Optional<String> conversationId = result.getConversationId();
        if (conversationId.isEmpty() || action.getId() == null
                || Objects.equals(conversationId.get(), config.get(ActionResult.CONVERSATION_ID))) {
            return;
        }
        try {
            actionPort.updateConfig(action.getId(), Map.of(ActionResult.CONVERSATION_ID, conversationId.get()));
            log.debug("[Scheduler] Action {} now writes to conversation {}", action.getId(), conversationId.get());
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Could not store conversation id for {}: {}", action.getId(), e.getMessage());
        }
    }

    private void sendCompletionNotification(ScheduledAction action, ActionResult result) {
        Optional<ActionExecutor> notifier = executorRegistry.find(NotificationExecutor.TYPE);
        if (notifier.isEmpty()) {
            log.warn("[Scheduler] Completion notification requested for {} but no notifier registered",
                    action.getId());
            return;
        }
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("title", "Scheduled Action Complete: " + action.getName());
        notification.put("message", "Status: " + (result.isSuccess() ? ActionStatus.SUCCESS : ActionStatus.ERROR).getValue());
        notification.put("type", result.isSuccess() ? "success" : "warning");
        try {
            ActionResult sent = notifier.get().execute(action.getOwner(), notification);
            if (sent == null || !sent.isSuccess()) {
                log.warn("[Scheduler] Completion notification for {} failed", action.getId());
            }
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Completion notification for {} failed: {}", action.getId(), e.getMessage());
        }
    }

    // ==================== OBSERVABILITY ====================

    public Optional<TimerStatus> status(String actionId) {
        if (actionId == null) {
            return Optional.empty();
        }
        LiveTimer timer = timers.get(actionId);
        if (timer == null || timer.getNextFireTime() == null) {
            return Optional.empty();
        }
        return Optional.of(new TimerStatus(actionId, timer.getActionName(), timer.getNextFireTime(),
                timer.getTrigger().describe()));
    }

    boolean isInFlight(String actionId) {
        return inFlight.contains(actionId);
    }

    public int armedTimerCount() {
        return timers.size();
    }
}
