package me.golemcore.actions.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.actions.domain.exception.ActionStorageException;
import me.golemcore.actions.domain.model.ScheduledAction;
import me.golemcore.actions.domain.model.ScheduledActionUpdate;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import me.golemcore.actions.infrastructure.config.AutoConfiguration;
import me.golemcore.actions.port.outbound.StoragePort;
import me.golemcore.actions.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonScheduledActionRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private ActionsProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private JsonScheduledActionRepository repository;

    @BeforeEach
    void setUp() {
        properties = new ActionsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);
        repository = new JsonScheduledActionRepository(storage, objectMapper, clock, properties);
    }

    @Test
    void shouldAssignIdAndTimestampsOnCreate() {
        ScheduledAction created = repository.create(action("user-1", "Digest"));

        assertNotNull(created.getId());
        assertEquals(NOW.getEpochSecond(), created.getCreatedAt());
        assertEquals(NOW.getEpochSecond(), created.getUpdatedAt());
        assertNull(created.getLastRunAt());
        assertTrue(repository.findById(created.getId()).isPresent());
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        ScheduledAction created = repository.create(action("user-1", "Digest"));

        JsonScheduledActionRepository reopened = new JsonScheduledActionRepository(storage, objectMapper, clock,
                properties);
        ScheduledAction loaded = reopened.findById(created.getId()).orElseThrow();

        assertEquals("Digest", loaded.getName());
        assertEquals("java", loaded.getActionConfig().get("query"));
        assertEquals("0 9 * * *", loaded.getScheduleConfig().get("expression"));

        String json = Files.readString(tempDir.resolve("actions").resolve("scheduled-actions.json"));
        assertTrue(json.contains("\"actionType\""));
        assertTrue(json.contains("\"save_to_chat\""));
        assertFalse(json.contains("oneShot"));
    }

    @Test
    void shouldListNewestFirstAndFilterByOwnerAndEnabled() {
        ScheduledAction first = repository.create(action("user-1", "First"));
        clock.advance(Duration.ofMinutes(1));
        ScheduledAction second = repository.create(action("user-2", "Second"));
        clock.advance(Duration.ofMinutes(1));
        ScheduledAction third = repository.create(action("user-1", "Third"));
        repository.disable(third.getId());

        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
                repository.findAll().stream().map(ScheduledAction::getId).toList());
        assertEquals(List.of("Third", "First"),
                repository.findByOwner("user-1").stream().map(ScheduledAction::getName).toList());
        assertEquals(List.of("Second", "First"),
                repository.findEnabled().stream().map(ScheduledAction::getName).toList());
    }

    @Test
    void shouldApplyOnlyNonNullUpdateFields() {
        ScheduledAction created = repository.create(action("user-1", "Digest"));
        clock.advance(Duration.ofSeconds(30));

        ScheduledAction updated = repository.update(created.getId(), ScheduledActionUpdate.builder()
                .description("weekday mornings")
                .build()).orElseThrow();

        assertEquals("Digest", updated.getName());
        assertEquals("weekday mornings", updated.getDescription());
        assertEquals("cron", updated.getScheduleType());
        assertEquals(NOW.plusSeconds(30).getEpochSecond(), updated.getUpdatedAt());
        assertTrue(repository.update("missing", ScheduledActionUpdate.enabled(false)).isEmpty());
    }

    @Test
    void shouldWriteOnlyProvidedRunTimes() {
        ScheduledAction created = repository.create(action("user-1", "Digest"));

        assertTrue(repository.updateRunTimes(created.getId(), 100L, 200L));
        assertTrue(repository.updateRunTimes(created.getId(), null, 300L));

        ScheduledAction loaded = repository.findById(created.getId()).orElseThrow();
        assertEquals(100L, loaded.getLastRunAt());
        assertEquals(300L, loaded.getNextRunAt());
        assertFalse(repository.updateRunTimes("missing", 1L, 2L));
    }

    @Test
    void shouldMergeConfigKeys() {
        ScheduledAction created = repository.create(action("user-1", "Digest"));

        ScheduledAction merged = repository.updateConfig(created.getId(), Map.of("chat_id", "chat-1"))
                .orElseThrow();

        assertEquals("chat-1", merged.getActionConfig().get("chat_id"));
        assertEquals("java", merged.getActionConfig().get("query"));
        assertEquals(true, merged.getActionConfig().get("save_to_chat"));
    }

    @Test
    void shouldDeleteSingleAndByOwner() {
        ScheduledAction a = repository.create(action("user-1", "A"));
        repository.create(action("user-1", "B"));
        repository.create(action("user-2", "C"));

        assertTrue(repository.delete(a.getId()));
        assertFalse(repository.delete(a.getId()));
        assertEquals(1, repository.deleteByOwner("user-1"));
        assertEquals(0, repository.deleteByOwner("user-1"));
        assertEquals(1, repository.findAll().size());
    }

    @Test
    void shouldReturnDetachedCopies() {
        ScheduledAction created = repository.create(action("user-1", "Digest"));

        ScheduledAction loaded = repository.findById(created.getId()).orElseThrow();
        loaded.setName("Mutated");
        loaded.getActionConfig().put("query", "changed");

        ScheduledAction again = repository.findById(created.getId()).orElseThrow();
        assertEquals("Digest", again.getName());
        assertEquals("java", again.getActionConfig().get("query"));
    }

    @Test
    void shouldFailOnCorruptFile() throws Exception {
        Files.writeString(tempDir.resolve("actions").resolve("scheduled-actions.json"), "{not json");

        assertThrows(ActionStorageException.class, () -> repository.findAll());
    }

    @Test
    void shouldWrapStorageFailuresAndKeepCache() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new ActionStorageException("disk full", null)));
        JsonScheduledActionRepository broken = new JsonScheduledActionRepository(failing, objectMapper, clock,
                properties);

        assertThrows(ActionStorageException.class, () -> broken.create(action("user-1", "Digest")));
        assertTrue(broken.findAll().isEmpty());
    }

    private static ScheduledAction action(String owner, String name) {
        return ScheduledAction.builder()
                .owner(owner)
                .name(name)
                .actionType("web_search")
                .actionConfig(Map.of("query", "java", "save_to_chat", true))
                .scheduleType("cron")
                .scheduleConfig(Map.of("expression", "0 9 * * *"))
                .build();
    }
}
