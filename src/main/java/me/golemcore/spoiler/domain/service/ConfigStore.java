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

package me.golemcore.spoiler.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.AdminAddOutcome;
import me.golemcore.spoiler.domain.model.ChatConfig;
import me.golemcore.spoiler.domain.model.SpoilerConfig;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import me.golemcore.spoiler.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Owner of all persisted bot configuration: per-chat keyword sets, the global
 * case mode, the bot administrator set and the set of enabled chats.
 *
 * <p>
 * Every read-modify-write sequence runs under one monitor together with its
 * write-through save, so concurrent commands serialize and a save never sees a
 * half-applied mutation. Accessors hand out copies; no caller holds a mutable
 * view of the state.
 *
 * <p>
 * Persistence failures are logged and never propagated: the in-memory state
 * stays authoritative until the next successful save.
 */
@Service
@Slf4j
public class ConfigStore {

    static final String KEYWORDS_FIELD = "spoiler_keywords";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String fileName;

    private final Object lock = new Object();

    private final Map<Long, Set<String>> keywordsByChat = new LinkedHashMap<>();
    private final Set<Long> administrators = new LinkedHashSet<>();
    private final Set<Long> enabledChats = new LinkedHashSet<>();
    private boolean caseSensitive;

    public ConfigStore(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getStorage().getConfigDirectory();
        this.fileName = properties.getStorage().getConfigFile();
    }

    @PostConstruct
    public void init() {
        load();
    }

    // ==================== Persistence ====================

    /**
     * Replaces the in-memory state with the persisted document. A missing
     * document is created with defaults; an unreadable one leaves the store
     * empty without touching the file.
     */
    public void load() {
        synchronized (lock) {
            resetLocked();

            String json;
            try {
                json = storagePort.getText(directory, fileName).join();
            } catch (RuntimeException e) { // NOSONAR - any read failure falls back to defaults
                log.error("[Config] Failed to read {}/{}, starting with empty configuration", directory, fileName, e);
                return;
            }

            if (json == null) {
                saveLocked();
                log.info("[Config] Created default configuration at {}/{}", directory, fileName);
                return;
            }

            try {
                JsonNode root = objectMapper.readTree(json);
                if (root == null || !root.isObject()) {
                    throw new IOException("Configuration root is not a JSON object");
                }
                boolean migrated = dropLegacyKeywordList((ObjectNode) root);
                SpoilerConfig document = objectMapper.treeToValue(root, SpoilerConfig.class);
                applyLocked(document);
                log.info("[Config] Loaded configuration: {} chats with keywords, {} admins, {} enabled chats",
                        keywordsByChat.size(), administrators.size(), enabledChats.size());
                if (migrated) {
                    saveLocked();
                }
            } catch (IOException | RuntimeException e) { // NOSONAR - corrupt file must not abort startup
                log.error("[Config] Failed to parse {}/{}, starting with empty configuration", directory, fileName, e);
                resetLocked();
            }
        }
    }

    /**
     * Writes the full state to storage.
     *
     * @return true if the write succeeded
     */
    public boolean save() {
        synchronized (lock) {
            return saveLocked();
        }
    }

    private boolean dropLegacyKeywordList(ObjectNode root) {
        JsonNode keywords = root.get(KEYWORDS_FIELD);
        if (keywords == null || !keywords.isArray()) {
            return false;
        }
        log.warn("[Config] Legacy flat keyword list with {} entries found; keywords are per chat now, "
                + "the list is discarded (previous file kept as .bak)", keywords.size());
        root.remove(KEYWORDS_FIELD);
        return true;
    }

    private void applyLocked(SpoilerConfig document) {
        if (document.getSpoilerKeywords() != null) {
            for (Map.Entry<String, List<String>> entry : document.getSpoilerKeywords().entrySet()) {
                Long chatId = parseChatId(entry.getKey());
                if (chatId == null || entry.getValue() == null) {
                    continue;
                }
                Set<String> keywords = new LinkedHashSet<>();
                for (String keyword : entry.getValue()) {
                    if (keyword != null && !keyword.isBlank()) {
                        keywords.add(keyword);
                    }
                }
                if (!keywords.isEmpty()) {
                    keywordsByChat.put(chatId, keywords);
                }
            }
        }
        caseSensitive = document.isCaseSensitive();
        addAllNonNull(administrators, document.getAdminUsers());
        addAllNonNull(enabledChats, document.getEnabledChats());
    }

    private static void addAllNonNull(Set<Long> target, List<Long> source) {
        if (source == null) {
            return;
        }
        for (Long value : source) {
            if (value != null) {
                target.add(value);
            }
        }
    }

    private static Long parseChatId(String key) {
        try {
            return Long.parseLong(key.trim());
        } catch (NumberFormatException e) {
            log.warn("[Config] Ignoring keywords for invalid chat id: {}", key);
            return null;
        }
    }

    private boolean saveLocked() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocumentLocked());
            storagePort.putTextAtomic(directory, fileName, json, true).join();
            log.debug("[Config] Configuration saved");
            return true;
        } catch (Exception e) { // NOSONAR - in-memory state stays authoritative
            log.error("[Config] Failed to save configuration to {}/{}", directory, fileName, e);
            return false;
        }
    }

    private SpoilerConfig toDocumentLocked() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywordsByChat.forEach((chatId, set) -> keywords.put(String.valueOf(chatId), new ArrayList<>(set)));
        return SpoilerConfig.builder()
                .spoilerKeywords(keywords)
                .caseSensitive(caseSensitive)
                .adminUsers(new ArrayList<>(administrators))
                .enabledChats(new ArrayList<>(enabledChats))
                .build();
    }

    private void resetLocked() {
        keywordsByChat.clear();
        administrators.clear();
        enabledChats.clear();
        caseSensitive = false;
    }

    // ==================== Keywords ====================

    /**
     * Returns the chat's keywords in insertion order, empty if none are
     * configured.
     */
    public Set<String> getChatKeywords(long chatId) {
        synchronized (lock) {
            Set<String> keywords = keywordsByChat.get(chatId);
            return keywords == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        }
    }

    /**
     * Returns every chat that has at least one keyword.
     */
    public Map<Long, Set<String>> getAllChatKeywords() {
        synchronized (lock) {
            Map<Long, Set<String>> copy = new LinkedHashMap<>();
            keywordsByChat.forEach((chatId, set) -> copy.put(chatId,
                    Collections.unmodifiableSet(new LinkedHashSet<>(set))));
            return copy;
        }
    }

    /**
     * Adds a keyword to the chat, lower-cased unless case sensitivity is on.
     *
     * @return true if the keyword was not present before
     * @throws IllegalArgumentException
     *             if the keyword is blank
     */
    public boolean addKeyword(long chatId, String keyword) {
        String trimmed = requireKeyword(keyword);
        synchronized (lock) {
            String normalized = applyCasePolicyLocked(trimmed);
            boolean added = keywordsByChat.computeIfAbsent(chatId, id -> new LinkedHashSet<>()).add(normalized);
            if (added) {
                saveLocked();
                log.info("[Config] Added keyword to chat {}: {}", chatId, normalized);
            }
            return added;
        }
    }

    /**
     * Removes a keyword from the chat, dropping the chat's entry when its last
     * keyword goes.
     *
     * @return false if the keyword was not configured for the chat
     */
    public boolean removeKeyword(long chatId, String keyword) {
        String trimmed = requireKeyword(keyword);
        synchronized (lock) {
            Set<String> keywords = keywordsByChat.get(chatId);
            if (keywords == null || !keywords.remove(applyCasePolicyLocked(trimmed))) {
                return false;
            }
            if (keywords.isEmpty()) {
                keywordsByChat.remove(chatId);
            }
            saveLocked();
            log.info("[Config] Removed keyword from chat {}: {}", chatId, trimmed);
            return true;
        }
    }

    private static String requireKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Keyword must not be blank");
        }
        return keyword.strip();
    }

    private String applyCasePolicyLocked(String keyword) {
        return caseSensitive ? keyword : keyword.toLowerCase(Locale.ROOT);
    }

    // ==================== Case sensitivity ====================

    public boolean isCaseSensitive() {
        synchronized (lock) {
            return caseSensitive;
        }
    }

    /**
     * Flips the case mode. Switching to case-insensitive lower-cases every stored
     * keyword of every chat; keywords differing only in case collapse into one.
     *
     * @return the new case mode
     */
    public boolean toggleCaseSensitivity() {
        synchronized (lock) {
            caseSensitive = !caseSensitive;
            if (!caseSensitive) {
                for (Map.Entry<Long, Set<String>> entry : keywordsByChat.entrySet()) {
                    Set<String> normalized = new LinkedHashSet<>();
                    for (String keyword : entry.getValue()) {
                        normalized.add(keyword.toLowerCase(Locale.ROOT));
                    }
                    entry.setValue(normalized);
                }
            }
            saveLocked();
            log.info("[Config] Case sensitivity {}", caseSensitive ? "enabled" : "disabled");
            return caseSensitive;
        }
    }

    // ==================== Chats ====================

    /**
     * @return true if the enabled state changed
     */
    public boolean setEnabled(long chatId, boolean enabled) {
        synchronized (lock) {
            boolean changed = enabled ? enabledChats.add(chatId) : enabledChats.remove(chatId);
            if (changed) {
                saveLocked();
                log.info("[Config] Chat {} {}", chatId, enabled ? "enabled" : "disabled");
            }
            return changed;
        }
    }

    public boolean isEnabled(long chatId) {
        synchronized (lock) {
            return enabledChats.contains(chatId);
        }
    }

    /**
     * Returns the chat's keywords, enabled flag and the case mode as one
     * consistent snapshot.
     */
    public ChatConfig getChatConfig(long chatId) {
        synchronized (lock) {
            Set<String> keywords = keywordsByChat.getOrDefault(chatId, Set.of());
            return new ChatConfig(chatId, keywords, enabledChats.contains(chatId), caseSensitive);
        }
    }

    // ==================== Administrators ====================

    public boolean isAdmin(long userId) {
        synchronized (lock) {
            return administrators.contains(userId);
        }
    }

    public boolean hasAdministrators() {
        synchronized (lock) {
            return !administrators.isEmpty();
        }
    }

    public Set<Long> getAdministrators() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(administrators));
        }
    }

    /**
     * Adds a bot administrator unconditionally.
     *
     * @return true if the user was not an administrator before
     */
    public boolean addAdmin(long userId) {
        return addAdminIf(userId, admins -> true) == AdminAddOutcome.ADDED;
    }

    /**
     * Adds a bot administrator if {@code precondition} accepts the current
     * administrator set. The check and the insertion happen in one critical
     * section.
     */
    public AdminAddOutcome addAdminIf(long userId, Predicate<Set<Long>> precondition) {
        synchronized (lock) {
            if (!precondition.test(Collections.unmodifiableSet(administrators))) {
                return AdminAddOutcome.DENIED;
            }
            if (!administrators.add(userId)) {
                return AdminAddOutcome.ALREADY_ADMIN;
            }
            saveLocked();
            log.info("[Config] Added administrator: {}", userId);
            return AdminAddOutcome.ADDED;
        }
    }

    /**
     * Adds several administrators with a single save.
     *
     * @return the ids that were not administrators before, in input order
     */
    public List<Long> addAdmins(Collection<Long> userIds) {
        synchronized (lock) {
            List<Long> added = new ArrayList<>();
            for (Long userId : userIds) {
                if (userId != null && administrators.add(userId)) {
                    added.add(userId);
                }
            }
            if (!added.isEmpty()) {
                saveLocked();
                log.info("[Config] Added administrators: {}", added);
            }
            return added;
        }
    }
}
