package me.golemcore.actions.domain.scheduler;

import me.golemcore.actions.domain.executor.ActionExecutorRegistry;
import me.golemcore.actions.domain.executor.NotificationExecutor;
import me.golemcore.actions.domain.model.ActionNotification;
import me.golemcore.actions.domain.model.ActionResult;
import me.golemcore.actions.domain.model.ActionStatus;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;
import me.golemcore.actions.domain.model.TimerStatus;
import me.golemcore.actions.domain.trigger.TriggerCalculator;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.port.outbound.NotificationPort;
import me.golemcore.actions.testsupport.InMemoryScheduledActionPort;
import me.golemcore.actions.testsupport.MutableClock;
import me.golemcore.actions.testsupport.StubActionExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ActionSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final String OWNER = "user-1";
    private static final String STUB_TYPE = "stub";

    private MutableClock clock;
    private InMemoryScheduledActionPort repository;
    private NotificationPort notificationPort;
    private StubActionExecutor stubExecutor;
    private ActionScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = new InMemoryScheduledActionPort();
        notificationPort = mock(NotificationPort.class);
        stubExecutor = new StubActionExecutor(STUB_TYPE);

        ActionsProperties properties = new ActionsProperties();
        properties.getScheduler().setShutdownTimeout(Duration.ofSeconds(2));

        ActionExecutorRegistry registry = new ActionExecutorRegistry(List.of(
                new NotificationExecutor(notificationPort, clock), stubExecutor));
        scheduler = new ActionScheduler(repository, registry, new TriggerCalculator(clock, properties),
                properties, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void shouldFireIntervalNotificationAndRecordRun() {
        ScheduledAction action = repository.put(action("Reminder", "notification",
                Map.of("title", "T", "message", "M"), "interval", Map.of("value", 5, "unit", "minutes")));

        scheduler.start();

        TimerStatus status = scheduler.status(action.getId()).orElseThrow();
        assertTrue(status.nextFireTime().isAfter(NOW));
        assertFalse(status.nextFireTime().isAfter(NOW.plus(Duration.ofMinutes(5))));
        assertEquals("interval[PT5M]", status.trigger());
        assertEquals(NOW.plus(Duration.ofMinutes(5)).getEpochSecond(),
                repository.findById(action.getId()).orElseThrow().getNextRunAt());

        clock.set(status.nextFireTime());
        ActionResult result = scheduler.fire(action.getId()).orElseThrow();

        assertEquals(ActionStatus.SUCCESS, result.getStatus());
        assertEquals("M", result.getMessage());
        assertEquals("T", result.get("title"));
        assertEquals("info", result.get("type"));
        assertEquals(status.nextFireTime().getEpochSecond(),
                repository.findById(action.getId()).orElseThrow().getLastRunAt());
    }

    @Test
    void shouldSkipMalformedCronWithoutBlockingOthers() {
        ScheduledAction bad = repository.put(action("Bad", STUB_TYPE, Map.of(), "cron",
                Map.of("expression", "x y z")));
        ScheduledAction good = repository.put(action("Good", STUB_TYPE, Map.of(), "cron",
                Map.of("expression", "0 12 * * *")));

        scheduler.start();

        assertEquals(1, scheduler.armedTimerCount());
        assertTrue(scheduler.status(bad.getId()).isEmpty());
        assertEquals(Instant.parse("2026-03-02T12:00:00Z"), scheduler.status(good.getId()).orElseThrow()
                .nextFireTime());
    }

    @Test
    void shouldSkipUnknownScheduleType() {
        ScheduledAction odd = repository.put(action("Odd", STUB_TYPE, Map.of(), "hourly", Map.of()));

        scheduler.start();

        assertTrue(scheduler.status(odd.getId()).isEmpty());
        assertEquals(0, scheduler.armedTimerCount());
    }

    @Test
    void shouldArmNothingForEmptyActionSet() {
        scheduler.start();

        assertTrue(scheduler.isRunning());
        assertEquals(0, scheduler.armedTimerCount());
    }

    @Test
    void shouldClearTimersWhenEveryActionIsDisabled() {
        ScheduledAction action = repository.put(intervalStub("Every minute", 1));
        scheduler.start();
        assertEquals(1, scheduler.armedTimerCount());

        repository.disable(action.getId());
        scheduler.reload();

        assertEquals(0, scheduler.armedTimerCount());
    }

    @Test
    void shouldRearmWithFreshFireTimeWhenReenabled() {
        ScheduledAction action = repository.put(intervalStub("Every five", 5));
        scheduler.start();
        Instant first = scheduler.status(action.getId()).orElseThrow().nextFireTime();

        repository.disable(action.getId());
        scheduler.reload();
        assertTrue(scheduler.status(action.getId()).isEmpty());

        clock.advance(Duration.ofMinutes(2));
        repository.update(action.getId(), ScheduledActionUpdate.enabled(true));
        scheduler.reload();

        Instant rearmed = scheduler.status(action.getId()).orElseThrow().nextFireTime();
        assertEquals(first.plus(Duration.ofMinutes(2)), rearmed);
    }

    @Test
    void shouldKeepCurrentTimersWhenSnapshotFails() {
        repository.put(intervalStub("Every five", 5));
        scheduler.start();

        repository.setFailFindEnabled(true);
        scheduler.reload();

        assertEquals(1, scheduler.armedTimerCount());
    }

    @Test
    void shouldDisableOneShotAfterSuccessfulRun() {
        ScheduledAction action = repository.put(onceStub("2026-03-03T08:00:00Z"));
        scheduler.start();

        Optional<ActionResult> result = scheduler.fire(action.getId());

        assertTrue(result.orElseThrow().isSuccess());
        assertFalse(repository.findById(action.getId()).orElseThrow().isEnabled());
        assertTrue(scheduler.status(action.getId()).isEmpty());
        assertEquals(1, stubExecutor.getInvocations().size());
    }

    @Test
    void shouldDisableOneShotAfterFailedRun() {
        stubExecutor.setBehavior(config -> ActionResult.error("provider down"));
        ScheduledAction action = repository.put(onceStub("2026-03-03T08:00:00Z"));
        scheduler.start();

        ActionResult result = scheduler.fire(action.getId()).orElseThrow();

        assertEquals(ActionStatus.ERROR, result.getStatus());
        assertFalse(repository.findById(action.getId()).orElseThrow().isEnabled());

        assertTrue(scheduler.fire(action.getId()).isEmpty());
        assertEquals(1, stubExecutor.getInvocations().size());
    }

    @Test
    void shouldDisableOneShotEvenWhenExecutorThrows() {
        stubExecutor.setBehavior(config -> {
            throw new IllegalStateException("boom");
        });
        ScheduledAction action = repository.put(onceStub("2026-03-03T08:00:00Z"));
        scheduler.start();

        ActionResult result = scheduler.fire(action.getId()).orElseThrow();

        assertEquals(ActionStatus.ERROR, result.getStatus());
        assertEquals("boom", result.getMessage());
        assertFalse(repository.findById(action.getId()).orElseThrow().isEnabled());
    }

    @Test
    void shouldRemoveTimerOfDeletedAction() {
        ScheduledAction action = repository.put(intervalStub("Every five", 5));
        scheduler.start();

        repository.delete(action.getId());
        Optional<ActionResult> result = scheduler.fire(action.getId());

        assertTrue(result.isEmpty());
        assertEquals(0, scheduler.armedTimerCount());
        assertTrue(stubExecutor.getInvocations().isEmpty());
    }

    @Test
    void shouldSkipActionDisabledSinceLastReload() {
        ScheduledAction action = repository.put(intervalStub("Every five", 5));
        scheduler.start();

        repository.disable(action.getId());
        Optional<ActionResult> result = scheduler.fire(action.getId());

        assertTrue(result.isEmpty());
        assertTrue(stubExecutor.getInvocations().isEmpty());
    }

    @Test
    void shouldSkipRunWhenActionCannotBeLoaded() {
        ScheduledAction action = repository.put(intervalStub("Every five", 5));
        scheduler.start();

        repository.setFailFindById(true);

        assertTrue(scheduler.fire(action.getId()).isEmpty());
        assertTrue(stubExecutor.getInvocations().isEmpty());
        assertEquals(1, scheduler.armedTimerCount());
    }

    @Test
    void shouldConvertExecutorExceptionToErrorResult() {
        stubExecutor.setBehavior(config -> {
            throw new IllegalStateException("search provider exploded");
        });
        ScheduledAction action = repository.put(intervalStub("Every five", 5));

        ActionResult result = scheduler.execute(action);

        assertEquals(ActionStatus.ERROR, result.getStatus());
        assertEquals("search provider exploded", result.getMessage());
    }

    @Test
    void shouldReportMissingExecutor() {
        ScheduledAction action = repository.put(action("Unknown", "bogus", Map.of(), "interval", Map.of()));

        ActionResult result = scheduler.execute(action);

        assertEquals(ActionStatus.ERROR, result.getStatus());
        assertEquals("No executor found for action type: bogus", result.getMessage());
    }

    @Test
    void shouldTreatNullExecutorResultAsError() {
        stubExecutor.setBehavior(config -> null);
        ScheduledAction action = repository.put(intervalStub("Every five", 5));

        assertEquals(ActionStatus.ERROR, scheduler.execute(action).getStatus());
    }

    @Test
    void shouldStillFireWhenBookkeepingWritesFail() {
        repository.setFailRunTimeUpdates(true);
        ScheduledAction action = repository.put(intervalStub("Every five", 5));

        scheduler.start();
        assertEquals(1, scheduler.armedTimerCount());

        ActionResult result = scheduler.fire(action.getId()).orElseThrow();

        assertTrue(result.isSuccess());
        assertEquals(1, stubExecutor.getInvocations().size());
        assertTrue(repository.getRunTimeUpdates() >= 2);
        assertEquals(1, scheduler.armedTimerCount());
    }

    @Test
    void shouldPersistConversationIdWithoutDroppingOtherKeys() {
        stubExecutor.setBehavior(config -> ActionResult.success().with(ActionResult.CONVERSATION_ID, "chat-42"));
        ScheduledAction action = repository.put(action("Digest", STUB_TYPE,
                Map.of("query", "java news", "engine", "brave"), "interval", Map.of("value", 1, "unit", "hours")));

        scheduler.execute(action);

        Map<String, Object> config = repository.findById(action.getId()).orElseThrow().getActionConfig();
        assertEquals("chat-42", config.get("chat_id"));
        assertEquals("java news", config.get("query"));
        assertEquals("brave", config.get("engine"));
    }

    @Test
    void shouldSendCompletionNotificationWhenRequested() {
        stubExecutor.setBehavior(config -> ActionResult.error("no results"));
        ScheduledAction action = repository.put(action("Digest", STUB_TYPE, Map.of("notify", true),
                "interval", Map.of()));

        scheduler.execute(action);

        ArgumentCaptor<ActionNotification> captor = ArgumentCaptor.forClass(ActionNotification.class);
        verify(notificationPort).send(captor.capture());
        ActionNotification notification = captor.getValue();
        assertEquals(OWNER, notification.owner());
        assertEquals("Scheduled Action Complete: Digest", notification.title());
        assertEquals("Status: error", notification.message());
        assertEquals("warning", notification.type());
    }

    @Test
    void shouldNotDisableOneShotOnManualRunUnlessAsked() {
        ScheduledAction action = repository.put(onceStub("2026-03-03T08:00:00Z"));
        scheduler.start();

        scheduler.executeNow(action);
        assertTrue(repository.findById(action.getId()).orElseThrow().isEnabled());
        assertEquals(NOW.getEpochSecond(), repository.findById(action.getId()).orElseThrow().getLastRunAt());

        scheduler.executeNow(action, true);
        assertFalse(repository.findById(action.getId()).orElseThrow().isEnabled());
    }

    @Test
    void shouldFirePastOneShotAsSoonAsArmed() throws InterruptedException {
        CountDownLatch executed = new CountDownLatch(1);
        stubExecutor.setBehavior(config -> {
            executed.countDown();
            return ActionResult.success();
        });
        ScheduledAction action = repository.put(onceStub("2026-03-01T09:00:00Z"));

        scheduler.start();

        assertTrue(executed.await(5, TimeUnit.SECONDS));
        awaitTrue(() -> !repository.findById(action.getId()).orElseThrow().isEnabled());
        assertEquals(0, scheduler.armedTimerCount());
        assertEquals(1, stubExecutor.getInvocations().size());
    }

    @Test
    void shouldRunOneShotOnceWhenReloadedDuringItsRun() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        stubExecutor.setBehavior(config -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return ActionResult.success();
        });
        ScheduledAction action = repository.put(onceStub("2026-03-01T09:00:00Z"));

        scheduler.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.isInFlight(action.getId()));

        scheduler.reload();
        awaitTrue(() -> scheduler.armedTimerCount() == 0);
        release.countDown();

        awaitTrue(() -> !scheduler.isInFlight(action.getId()));
        assertFalse(repository.findById(action.getId()).orElseThrow().isEnabled());
        assertEquals(1, stubExecutor.getInvocations().size());
        assertEquals(1, maxActive.get());
    }

    @Test
    void shouldSkipFireMissedBeyondGraceTime() throws InterruptedException {
        ScheduledAction action = repository.put(onceStub("2026-03-02T10:00:01Z"));
        scheduler.start();
        assertNotNull(scheduler.status(action.getId()).orElse(null));

        clock.advance(Duration.ofMinutes(10));

        awaitTrue(() -> scheduler.armedTimerCount() == 0);
        Thread.sleep(200);
        assertTrue(stubExecutor.getInvocations().isEmpty());
        assertTrue(repository.findById(action.getId()).orElseThrow().isEnabled());
    }

    @Test
    void shouldKeepSingleTimerPerActionUnderConcurrentReloads() throws Exception {
        ScheduledAction action = repository.put(intervalStub("Every five", 5));
        repository.put(intervalStub("Other", 10));
        scheduler.start();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(pool.submit(scheduler::reload));
                futures.add(pool.submit(() -> scheduler.fire(action.getId())));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2, scheduler.armedTimerCount());
        assertTrue(scheduler.status(action.getId()).isPresent());
        assertEquals(20, stubExecutor.getInvocations().size());
    }

    @Test
    void shouldIgnoreReloadWhileStopped() {
        repository.put(intervalStub("Every five", 5));

        scheduler.reload();
        assertEquals(0, scheduler.armedTimerCount());

        scheduler.start();
        scheduler.start();
        assertEquals(1, scheduler.armedTimerCount());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertEquals(0, scheduler.armedTimerCount());
    }

    private static ScheduledAction action(String name, String type, Map<String, Object> config,
            String scheduleType, Map<String, Object> scheduleConfig) {
        return ScheduledAction.builder()
                .owner(OWNER)
                .name(name)
                .actionType(type)
                .actionConfig(config)
                .scheduleType(scheduleType)
                .scheduleConfig(scheduleConfig)
                .enabled(true)
                .build();
    }

    private static ScheduledAction intervalStub(String name, int minutes) {
        return action(name, STUB_TYPE, Map.of(), "interval", Map.of("value", minutes, "unit", "minutes"));
    }

    private static ScheduledAction onceStub(String datetime) {
        return action("Once", STUB_TYPE, Map.of(), "once", Map.of("datetime", datetime));
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(20);
        }
        fail("Condition not met within 5s");
    }
}
