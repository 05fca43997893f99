package me.golemcore.actions.adapter.outbound.storage;

import me.golemcore.actions.domain.exception.ActionStorageException;
import me.golemcore.actions.infrastructure.config.ActionsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ActionsProperties properties = new ActionsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsWorkspaceDirectories() {
        assertEquals(tempDir.toAbsolutePath().normalize(), storageAdapter.getBasePath());
        assertTrue(Files.isDirectory(tempDir.resolve("actions")));
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
        assertTrue(Files.isDirectory(tempDir.resolve("memory")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "nested/test-file.txt", "Hello, World!").get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "nested/test-file.txt").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void exists_reflectsWritesAndDeletes() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, "file.txt").get());

        storageAdapter.putText(TEST_DIR, "file.txt", CONTENT_DEFAULT).get();
        assertTrue(storageAdapter.exists(TEST_DIR, "file.txt").get());

        storageAdapter.deleteObject(TEST_DIR, "file.txt").get();
        assertFalse(storageAdapter.exists(TEST_DIR, "file.txt").get());
    }

    @Test
    void listObjects_returnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "b.txt", CONTENT_DEFAULT).get();
        storageAdapter.putText(TEST_DIR, "a.txt", CONTENT_DEFAULT).get();
        storageAdapter.putText(TEST_DIR, "sub/c.txt", CONTENT_DEFAULT).get();

        List<String> all = storageAdapter.listObjects(TEST_DIR, "").get();
        List<String> sub = storageAdapter.listObjects(TEST_DIR, "sub").get();

        assertEquals(List.of("a.txt", "b.txt", "sub" + tempDir.getFileSystem().getSeparator() + "c.txt"), all);
        assertEquals(1, sub.size());
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void appendText_appendsLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "one\n").get();
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "two\n").get();

        assertEquals("one\ntwo\n", storageAdapter.getText(TEST_DIR, "log.jsonl").get());
    }

    @Test
    void putTextAtomic_replacesContentAndKeepsBackup() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v1", true).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TEST_DIR, "state.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve(TEST_DIR).resolve("state.json.bak")));
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.tmp")));
    }

    @Test
    void putTextAtomic_withoutBackupLeavesNoBakFile() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v1", false).get();
        storageAdapter.putTextAtomic(TEST_DIR, "state.json", "v2", false).get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("state.json.bak")));
    }

    @Test
    void putTextAtomic_failsWhenTargetIsDirectory() throws Exception {
        Files.createDirectories(tempDir.resolve(TEST_DIR).resolve("taken").resolve("child"));

        CompletionException e = assertThrows(CompletionException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "taken", "data", false).join());
        assertInstanceOf(ActionStorageException.class, e.getCause());
    }

    @Test
    void resolvePath_blocksTraversal() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
