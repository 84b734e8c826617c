package me.golemcore.spoiler.adapter.outbound.storage;

import me.golemcore.spoiler.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE = "spoiler_config.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateConfigDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(CONFIG_DIR)));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText(CONFIG_DIR, CONFIG_FILE).join());
    }

    @Test
    void shouldWriteAndReadText() {
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "{\"chats\":{}}", false).join();

        assertEquals("{\"chats\":{}}", adapter.getText(CONFIG_DIR, CONFIG_FILE).join());
        assertFalse(Files.exists(tempDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE + ".tmp")));
    }

    @Test
    void shouldKeepPreviousVersionAsBackup() throws Exception {
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "first", true).join();
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "second", true).join();

        Path backup = tempDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE + ".bak");
        assertEquals("first", Files.readString(backup, StandardCharsets.UTF_8));
        assertEquals("second", adapter.getText(CONFIG_DIR, CONFIG_FILE).join());
    }

    @Test
    void shouldNotBackupWhenDisabled() {
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "first", false).join();
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "second", false).join();

        assertFalse(Files.exists(tempDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE + ".bak")));
    }

    @Test
    void shouldPreserveUnicodeContent() {
        adapter.putTextAtomic(CONFIG_DIR, CONFIG_FILE, "[\"спойлер\",\"🎬\"]", false).join();

        assertEquals("[\"спойлер\",\"🎬\"]", adapter.getText(CONFIG_DIR, CONFIG_FILE).join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> adapter.getText(CONFIG_DIR, "../../outside.json").join());
        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());

        CompletionException writeThrown = assertThrows(CompletionException.class,
                () -> adapter.putTextAtomic("..", "../escape.json", "x", false).join());
        assertInstanceOf(IllegalArgumentException.class, writeThrown.getCause());
    }
}
