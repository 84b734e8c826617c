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

package me.golemcore.spoiler.adapter.inbound.command;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.AdminAddOutcome;
import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.domain.service.AdminSyncService;
import me.golemcore.spoiler.domain.service.ConfigStore;
import me.golemcore.spoiler.infrastructure.i18n.MessageService;
import me.golemcore.spoiler.port.inbound.CommandPort;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import me.golemcore.spoiler.security.AuthorizationGate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;

/**
 * Routes bot commands to their handlers.
 *
 * <p>
 * The dispatch table is built once in the constructor:
 *
 * <ul>
 * <li>/start, /help - Welcome and command reference (public)
 * <li>/add_keyword &lt;word...&gt;, /remove_keyword &lt;word...&gt; - Edit this
 * chat's keywords
 * <li>/list_keywords - This chat's keywords (public)
 * <li>/list_all_keywords - Keywords of every chat
 * <li>/enable_chat, /disable_chat - Switch detection for this chat
 * <li>/toggle_case - Flip global case sensitivity
 * <li>/add_admin &lt;user_id&gt; - Register a bot administrator (open to anyone
 * while there are none)
 * <li>/sync_admins - Import this chat's platform administrators
 * </ul>
 *
 * <p>
 * Admin-only commands are rejected before their handler runs when the caller
 * is not a bot administrator. Replies are written in the bot's Markdown subset.
 *
 * @see me.golemcore.spoiler.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    static final String CMD_START = "start";
    static final String CMD_HELP = "help";
    static final String CMD_ADD_KEYWORD = "add_keyword";
    static final String CMD_REMOVE_KEYWORD = "remove_keyword";
    static final String CMD_LIST_KEYWORDS = "list_keywords";
    static final String CMD_LIST_ALL_KEYWORDS = "list_all_keywords";
    static final String CMD_ENABLE_CHAT = "enable_chat";
    static final String CMD_DISABLE_CHAT = "disable_chat";
    static final String CMD_TOGGLE_CASE = "toggle_case";
    static final String CMD_ADD_ADMIN = "add_admin";
    static final String CMD_SYNC_ADMINS = "sync_admins";

    private static final String PERMISSION_KEYWORDS = "permission.keywords";
    private static final String PERMISSION_CHATS = "permission.chats";
    private static final String PERMISSION_SETTINGS = "permission.settings";
    private static final String PERMISSION_ADMINS = "permission.admins";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String NEWLINE = "\n";

    private final ConfigStore configStore;
    private final AuthorizationGate authorizationGate;
    private final AdminSyncService adminSyncService;
    private final ChatPlatformPort chatPlatform;
    private final MessageService messageService;

    private final Map<String, RegisteredCommand> commands = new LinkedHashMap<>();

    public CommandRouter(
            ConfigStore configStore,
            AuthorizationGate authorizationGate,
            AdminSyncService adminSyncService,
            ChatPlatformPort chatPlatform,
            MessageService messageService) {
        this.configStore = configStore;
        this.authorizationGate = authorizationGate;
        this.adminSyncService = adminSyncService;
        this.chatPlatform = chatPlatform;
        this.messageService = messageService;

        register(CMD_START, null, this::handleStart);
        register(CMD_HELP, null, this::handleHelp);
        register(CMD_ADD_KEYWORD, PERMISSION_KEYWORDS, this::handleAddKeyword);
        register(CMD_REMOVE_KEYWORD, PERMISSION_KEYWORDS, this::handleRemoveKeyword);
        register(CMD_LIST_KEYWORDS, null, this::handleListKeywords);
        register(CMD_LIST_ALL_KEYWORDS, PERMISSION_KEYWORDS, this::handleListAllKeywords);
        register(CMD_ENABLE_CHAT, PERMISSION_CHATS, invocation -> handleSetEnabled(invocation, true));
        register(CMD_DISABLE_CHAT, PERMISSION_CHATS, invocation -> handleSetEnabled(invocation, false));
        register(CMD_TOGGLE_CASE, PERMISSION_SETTINGS, this::handleToggleCase);
        register(CMD_ADD_ADMIN, null, this::handleAddAdmin);
        register(CMD_SYNC_ADMINS, PERMISSION_ADMINS, this::handleSyncAdmins);
        log.info("CommandRouter initialized with commands: {}", commands.keySet());
    }

    private void register(String name, String permissionKey, CommandHandler handler) {
        CommandDefinition definition = new CommandDefinition(
                name,
                msg("command." + name + ".desc"),
                "/" + name,
                permissionKey != null);
        commands.put(name, new RegisteredCommand(definition, permissionKey, handler));
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        String name = normalize(invocation.command());
        RegisteredCommand command = commands.get(name);
        if (command == null) {
            return CommandResult.failure(msg("command.unknown", name));
        }
        log.debug("[Command] /{} chat={} user={} args={}", name, invocation.chatId(), invocation.userId(),
                invocation.args().size());
        if (command.definition().adminOnly() && !authorizationGate.canManage(invocation.userId())) {
            return CommandResult.failure(msg(command.permissionKey()));
        }
        return command.handler().handle(invocation);
    }

    @Override
    public boolean hasCommand(String command) {
        return commands.containsKey(normalize(command));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return commands.values().stream().map(RegisteredCommand::definition).toList();
    }

    // ==================== Public commands ====================

    private CommandResult handleStart(CommandInvocation invocation) {
        return CommandResult.success(msg("command.start.text"));
    }

    private CommandResult handleHelp(CommandInvocation invocation) {
        return CommandResult.success(msg("command.help.text"));
    }

    private CommandResult handleListKeywords(CommandInvocation invocation) {
        Set<String> keywords = configStore.getChatKeywords(invocation.chatId());
        if (keywords.isEmpty()) {
            return CommandResult.success(msg("command.list_keywords.empty"));
        }
        return CommandResult.success(msg("command.list_keywords.header", caseInfo())
                + DOUBLE_NEWLINE + formatKeywordList(keywords));
    }

    // ==================== Keyword management ====================

    private CommandResult handleAddKeyword(CommandInvocation invocation) {
        String keyword = joinArgs(invocation.args());
        if (keyword.isEmpty()) {
            return CommandResult.failure(msg("command.add_keyword.usage"));
        }
        if (!configStore.addKeyword(invocation.chatId(), keyword)) {
            return CommandResult.success(msg("command.add_keyword.exists", keyword));
        }
        log.info("[Command] Keyword added in chat {} by user {}", invocation.chatId(), invocation.userId());
        return CommandResult.success(msg("command.add_keyword.done", keyword));
    }

    private CommandResult handleRemoveKeyword(CommandInvocation invocation) {
        String keyword = joinArgs(invocation.args());
        if (keyword.isEmpty()) {
            return CommandResult.failure(msg("command.remove_keyword.usage"));
        }
        if (!configStore.removeKeyword(invocation.chatId(), keyword)) {
            return CommandResult.failure(msg("command.remove_keyword.missing", keyword));
        }
        log.info("[Command] Keyword removed in chat {} by user {}", invocation.chatId(), invocation.userId());
        return CommandResult.success(msg("command.remove_keyword.done", keyword));
    }

    private CommandResult handleListAllKeywords(CommandInvocation invocation) {
        Map<Long, Set<String>> all = new TreeMap<>(configStore.getAllChatKeywords());
        if (all.isEmpty()) {
            return CommandResult.success(msg("command.list_all_keywords.empty"));
        }
        StringBuilder sb = new StringBuilder(msg("command.list_all_keywords.header", caseInfo()));
        for (Map.Entry<Long, Set<String>> entry : all.entrySet()) {
            sb.append(DOUBLE_NEWLINE)
                    .append(msg("command.list_all_keywords.chat", resolveChatLabel(entry.getKey())))
                    .append(NEWLINE)
                    .append(formatKeywordList(entry.getValue()));
        }
        return CommandResult.success(sb.toString());
    }

    private String resolveChatLabel(long chatId) {
        String id = String.valueOf(chatId);
        try {
            Optional<String> title = chatPlatform.getChatTitle(chatId).join();
            return title.filter(t -> !t.isBlank()).orElse(id);
        } catch (CompletionException e) { // NOSONAR
            log.debug("[Command] Chat title unavailable for {}: {}", chatId, e.getMessage());
            return id;
        }
    }

    // ==================== Chat and settings ====================

    private CommandResult handleSetEnabled(CommandInvocation invocation, boolean enabled) {
        configStore.setEnabled(invocation.chatId(), enabled);
        log.info("[Command] Detection {} in chat {} by user {}", enabled ? "enabled" : "disabled",
                invocation.chatId(), invocation.userId());
        return CommandResult.success(msg(enabled ? "command.enable_chat.done" : "command.disable_chat.done"));
    }

    private CommandResult handleToggleCase(CommandInvocation invocation) {
        boolean caseSensitive = configStore.toggleCaseSensitivity();
        return CommandResult.success(msg(caseSensitive
                ? "command.toggle_case.enabled"
                : "command.toggle_case.disabled"));
    }

    // ==================== Administrators ====================

    private CommandResult handleAddAdmin(CommandInvocation invocation) {
        if (!authorizationGate.canAddAdmin(invocation.userId())) {
            return CommandResult.failure(msg("permission.add-admin"));
        }
        if (invocation.args().isEmpty()) {
            return CommandResult.failure(msg("command.add_admin.usage"));
        }
        long newAdminId;
        try {
            newAdminId = Long.parseLong(invocation.args().get(0).trim());
        } catch (NumberFormatException e) { // NOSONAR
            return CommandResult.failure(msg("command.add_admin.invalid"));
        }

        AdminAddOutcome outcome = authorizationGate.addAdmin(invocation.userId(), newAdminId);
        String id = String.valueOf(newAdminId);
        return switch (outcome) {
        case ADDED -> CommandResult.success(msg("command.add_admin.done", id));
        case ALREADY_ADMIN -> CommandResult.success(msg("command.add_admin.exists", id));
        case DENIED -> CommandResult.failure(msg("permission.add-admin"));
        };
    }

    private CommandResult handleSyncAdmins(CommandInvocation invocation) {
        List<ChatUser> added;
        try {
            added = adminSyncService.syncFromPlatform(invocation.chatId());
        } catch (CompletionException e) {
            log.warn("[Command] Admin sync failed for chat {}: {}", invocation.chatId(), e.getMessage());
            return CommandResult.failure(msg("command.sync_admins.failed"));
        }
        if (added.isEmpty()) {
            return CommandResult.success(msg("command.sync_admins.none"));
        }
        return CommandResult.success(msg("command.sync_admins.done", String.valueOf(added.size()))
                + DOUBLE_NEWLINE + formatAdminList(added));
    }

    private String formatAdminList(List<ChatUser> admins) {
        List<String> lines = new ArrayList<>();
        for (ChatUser admin : admins) {
            lines.add(msg("command.admin.item", admin.getDisplayIdentity(), String.valueOf(admin.getId())));
        }
        return String.join(NEWLINE, lines);
    }

    // ==================== Helpers ====================

    private String formatKeywordList(Set<String> keywords) {
        List<String> sorted = new ArrayList<>(keywords);
        Collections.sort(sorted);
        List<String> lines = new ArrayList<>();
        for (String keyword : sorted) {
            lines.add(msg("command.keyword.item", keyword));
        }
        return String.join(NEWLINE, lines);
    }

    private String caseInfo() {
        return msg(configStore.isCaseSensitive() ? "command.case.sensitive" : "command.case.insensitive");
    }

    private static String joinArgs(List<String> args) {
        return String.join(" ", args).strip();
    }

    private static String normalize(String command) {
        return command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    private record RegisteredCommand(CommandDefinition definition, String permissionKey, CommandHandler handler) {
    }
}
