package me.golemcore.spoiler.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.spoiler.domain.model.ChatConfig;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import me.golemcore.spoiler.support.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigStoreTest {

    private static final String DIR = "config";
    private static final String FILE = "spoiler_config.json";
    private static final long CHAT_A = -1001L;
    private static final long CHAT_B = -1002L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryStoragePort storage;
    private ConfigStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        store = newStore();
        store.load();
    }

    private ConfigStore newStore() {
        return new ConfigStore(storage, objectMapper, new BotProperties());
    }

    private JsonNode persisted() throws Exception {
        return objectMapper.readTree(storage.read(DIR, FILE));
    }

    // ===== Loading =====

    @Test
    void shouldCreateDefaultFileWhenMissing() throws Exception {
        JsonNode root = persisted();

        assertNotNull(root);
        assertTrue(root.get("spoiler_keywords").isObject());
        assertFalse(root.get("case_sensitive").asBoolean());
        assertEquals(0, root.get("admin_users").size());
        assertEquals(0, root.get("enabled_chats").size());
    }

    @Test
    void shouldRoundTripConfiguration() {
        store.addKeyword(CHAT_A, "leak");
        store.addKeyword(CHAT_A, "finale");
        store.addKeyword(CHAT_B, "ending");
        store.setEnabled(CHAT_A, true);
        store.addAdmin(42L);
        store.toggleCaseSensitivity();

        ConfigStore reloaded = newStore();
        reloaded.load();

        assertEquals(Set.of("leak", "finale"), reloaded.getChatKeywords(CHAT_A));
        assertEquals(Set.of("ending"), reloaded.getChatKeywords(CHAT_B));
        assertTrue(reloaded.isEnabled(CHAT_A));
        assertFalse(reloaded.isEnabled(CHAT_B));
        assertTrue(reloaded.isAdmin(42L));
        assertTrue(reloaded.isCaseSensitive());
    }

    @Test
    void shouldMigrateLegacyFlatKeywordList() throws Exception {
        storage.write(DIR, FILE, """
                {"spoiler_keywords": ["endgame", "leak"], "case_sensitive": true,
                 "admin_users": [7], "enabled_chats": [-100]}
                """);

        store.load();

        assertTrue(store.getAllChatKeywords().isEmpty());
        assertTrue(store.isAdmin(7L));
        assertTrue(store.isEnabled(-100L));
        assertTrue(store.isCaseSensitive());
        assertTrue(persisted().get("spoiler_keywords").isObject());
        assertEquals(1, storage.getBackups().size());
        assertTrue(storage.getBackups().get(0).contains("endgame"));
    }

    @Test
    void shouldFallBackToEmptyOnCorruptFileWithoutOverwriting() {
        store.addAdmin(1L);
        String corrupt = "{ this is not json";
        storage.write(DIR, FILE, corrupt);

        store.load();

        assertFalse(store.hasAdministrators());
        assertTrue(store.getAllChatKeywords().isEmpty());
        assertEquals(corrupt, storage.read(DIR, FILE));
    }

    @Test
    void shouldFallBackToEmptyWhenRootIsNotAnObject() {
        storage.write(DIR, FILE, "[1, 2, 3]");

        store.load();

        assertTrue(store.getAllChatKeywords().isEmpty());
        assertEquals("[1, 2, 3]", storage.read(DIR, FILE));
    }

    @Test
    void shouldFallBackToEmptyWhenReadFails() {
        store.addKeyword(CHAT_A, "leak");
        storage.setFailReads(true);

        store.load();

        assertTrue(store.getChatKeywords(CHAT_A).isEmpty());
    }

    @Test
    void shouldSkipInvalidChatKeysAndBlankKeywords() {
        storage.write(DIR, FILE, """
                {"spoiler_keywords": {"not-a-chat": ["x"], "-5": ["ok", " ", ""], "-6": []},
                 "case_sensitive": false, "admin_users": [], "enabled_chats": []}
                """);

        store.load();

        assertEquals(Map.of(-5L, Set.of("ok")), store.getAllChatKeywords());
    }

    // ===== Keywords =====

    @Test
    void shouldKeepKeywordsPerChat() {
        store.addKeyword(CHAT_A, "leak");

        assertEquals(Set.of("leak"), store.getChatKeywords(CHAT_A));
        assertTrue(store.getChatKeywords(CHAT_B).isEmpty());
    }

    @Test
    void shouldLowerCaseKeywordsWhenCaseInsensitive() {
        assertTrue(store.addKeyword(CHAT_A, "  Spoiler "));
        assertFalse(store.addKeyword(CHAT_A, "SPOILER"));

        assertEquals(Set.of("spoiler"), store.getChatKeywords(CHAT_A));
        assertTrue(store.removeKeyword(CHAT_A, "SpOiLeR"));
    }

    @Test
    void shouldRejectBlankKeyword() {
        assertThrows(IllegalArgumentException.class, () -> store.addKeyword(CHAT_A, "   "));
        assertThrows(IllegalArgumentException.class, () -> store.removeKeyword(CHAT_A, null));
    }

    @Test
    void shouldReturnFalseWhenRemovingUnknownKeyword() {
        store.addKeyword(CHAT_A, "leak");

        assertFalse(store.removeKeyword(CHAT_A, "other"));
        assertFalse(store.removeKeyword(CHAT_B, "leak"));
    }

    @Test
    void shouldPruneChatWhenLastKeywordRemoved() throws Exception {
        store.addKeyword(CHAT_A, "leak");
        store.addKeyword(CHAT_B, "other");

        assertTrue(store.removeKeyword(CHAT_A, "leak"));

        assertTrue(store.getChatKeywords(CHAT_A).isEmpty());
        assertFalse(store.getAllChatKeywords().containsKey(CHAT_A));
        JsonNode keywords = persisted().get("spoiler_keywords");
        assertFalse(keywords.has(String.valueOf(CHAT_A)));
        assertTrue(keywords.has(String.valueOf(CHAT_B)));
    }

    @Test
    void shouldHandOutCopies() {
        store.addKeyword(CHAT_A, "leak");
        Set<String> snapshot = store.getChatKeywords(CHAT_A);

        store.addKeyword(CHAT_A, "other");

        assertEquals(Set.of("leak"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("x"));
    }

    // ===== Case sensitivity =====

    @Test
    void shouldCollapseKeywordsWhenSwitchingToCaseInsensitive() throws Exception {
        assertTrue(store.toggleCaseSensitivity());
        store.addKeyword(CHAT_A, "Leak");
        store.addKeyword(CHAT_A, "LEAK");
        store.addKeyword(CHAT_B, "Finale");
        assertEquals(Set.of("Leak", "LEAK"), store.getChatKeywords(CHAT_A));

        assertFalse(store.toggleCaseSensitivity());

        assertEquals(Set.of("leak"), store.getChatKeywords(CHAT_A));
        assertEquals(Set.of("finale"), store.getChatKeywords(CHAT_B));
        assertEquals(1, persisted().get("spoiler_keywords").get(String.valueOf(CHAT_A)).size());
    }

    @Test
    void shouldKeepStoredCasingWhenSwitchingToCaseSensitive() {
        store.addKeyword(CHAT_A, "leak");

        assertTrue(store.toggleCaseSensitivity());
        store.addKeyword(CHAT_A, "Finale");

        assertEquals(Set.of("leak", "Finale"), store.getChatKeywords(CHAT_A));
    }

    // ===== Chats and snapshots =====

    @Test
    void shouldReportEnabledChanges() {
        assertTrue(store.setEnabled(CHAT_A, true));
        assertFalse(store.setEnabled(CHAT_A, true));
        assertTrue(store.setEnabled(CHAT_A, false));
        assertFalse(store.isEnabled(CHAT_A));
    }

    @Test
    void shouldSnapshotChatConfig() {
        store.addKeyword(CHAT_A, "leak");
        store.setEnabled(CHAT_A, true);

        ChatConfig config = store.getChatConfig(CHAT_A);

        assertEquals(CHAT_A, config.chatId());
        assertEquals(Set.of("leak"), config.keywords());
        assertTrue(config.enabled());
        assertFalse(config.caseSensitive());
        assertFalse(store.getChatConfig(CHAT_B).hasKeywords());
    }

    // ===== Persistence failures =====

    @Test
    void shouldKeepInMemoryStateWhenSaveFails() {
        storage.setFailWrites(true);

        assertTrue(store.addKeyword(CHAT_A, "leak"));
        assertFalse(store.save());

        assertEquals(Set.of("leak"), store.getChatKeywords(CHAT_A));

        storage.setFailWrites(false);
        assertTrue(store.save());
        ConfigStore reloaded = newStore();
        reloaded.load();
        assertEquals(Set.of("leak"), reloaded.getChatKeywords(CHAT_A));
    }

    // ===== Administrators =====

    @Test
    void shouldAddAdminsInBatchSkippingKnownOnes() {
        store.addAdmin(1L);

        List<Long> added = store.addAdmins(List.of(1L, 2L, 3L, 2L));

        assertEquals(List.of(2L, 3L), added);
        assertEquals(Set.of(1L, 2L, 3L), store.getAdministrators());
        assertTrue(store.addAdmins(List.of(1L, 3L)).isEmpty());
    }

    // ===== Concurrency =====

    @Test
    void shouldNotLoseConcurrentKeywordAdditions() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.addKeyword(CHAT_A, "kw-" + thread + "-" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, store.getChatKeywords(CHAT_A).size());
        ConfigStore reloaded = newStore();
        reloaded.load();
        assertEquals(threads * perThread, reloaded.getChatKeywords(CHAT_A).size());
    }

    @Test
    void shouldSerializeToggleWithConcurrentAdditions() throws Exception {
        store.toggleCaseSensitivity();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                int n = i;
                futures.add(executor.submit(() -> store.addKeyword(CHAT_A, "Word" + n)));
            }
            futures.add(executor.submit(store::toggleCaseSensitivity));
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertFalse(store.isCaseSensitive());
        assertEquals(100, store.getChatKeywords(CHAT_A).size());
        assertTrue(store.getChatKeywords(CHAT_A).stream().allMatch(k -> k.equals(k.toLowerCase())));
    }
}
