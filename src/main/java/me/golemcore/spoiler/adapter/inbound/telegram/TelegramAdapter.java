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

package me.golemcore.spoiler.adapter.inbound.telegram;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.adapter.outbound.telegram.TelegramUsers;
import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.domain.model.InboundTextMessage;
import me.golemcore.spoiler.domain.model.PipelineResult;
import me.golemcore.spoiler.domain.pipeline.MessagePipeline;
import me.golemcore.spoiler.domain.service.AdminSyncService;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import me.golemcore.spoiler.infrastructure.i18n.MessageService;
import me.golemcore.spoiler.port.inbound.ChannelPort;
import me.golemcore.spoiler.port.inbound.CommandPort;
import me.golemcore.spoiler.port.inbound.CommandPort.CommandInvocation;
import me.golemcore.spoiler.port.inbound.CommandPort.CommandResult;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMemberUpdated;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * The polling thread only hands updates over to the dispatch pool; each update
 * is then processed on its own inside an error boundary, so a failure is logged
 * and never reaches the next update. Updates are routed as follows:
 * <ul>
 * <li>Known slash commands to {@link CommandPort}, replying in the same thread
 * <li>Other text messages, unknown slash commands included, to
 * {@link MessagePipeline}
 * <li>The bot's promotion to chat administrator to {@link AdminSyncService}
 * </ul>
 *
 * <p>
 * Before polling starts the adapter checks that no other instance is polling
 * with the same token and refuses to start otherwise. Conflicts appearing later
 * are tracked by {@link PollingConflictMonitor} and make the channel report
 * itself as not running.
 *
 * @see me.golemcore.spoiler.port.inbound.ChannelPort
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String STATUS_ADMINISTRATOR = "administrator";
    private static final int HTTP_CONFLICT = 409;
    private static final String CONFLICT_OTHER_POLLER = "terminated by other getupdates request";
    private static final String CONFLICT_WEBHOOK = "webhook is active";

    private final BotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramClient telegramClient;
    private final CommandPort commandRouter;
    private final MessagePipeline messagePipeline;
    private final AdminSyncService adminSyncService;
    private final ChatPlatformPort chatPlatform;
    private final MessageService messageService;
    private final PollingConflictMonitor conflictMonitor;
    private final Executor updateExecutor;

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    public TelegramAdapter(
            BotProperties properties,
            TelegramBotsLongPollingApplication botsApplication,
            TelegramClient telegramClient,
            CommandPort commandRouter,
            MessagePipeline messagePipeline,
            AdminSyncService adminSyncService,
            ChatPlatformPort chatPlatform,
            MessageService messageService,
            PollingConflictMonitor conflictMonitor,
            @Qualifier(TelegramConfig.UPDATE_EXECUTOR) Executor updateExecutor) {
        this.properties = properties;
        this.botsApplication = botsApplication;
        this.telegramClient = telegramClient;
        this.commandRouter = commandRouter;
        this.messagePipeline = messagePipeline;
        this.adminSyncService = adminSyncService;
        this.chatPlatform = chatPlatform;
        this.messageService = messageService;
        this.conflictMonitor = conflictMonitor;
        this.updateExecutor = updateExecutor;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            ensureNoOtherInstance();

            try {
                botsApplication.registerBot(TelegramConfig.requireToken(properties), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("Telegram bot already registered; keeping existing polling session active");
                    return;
                }
                throw new IllegalStateException("Failed to start Telegram adapter", e);
            }
        }
    }

    /**
     * Asks Telegram for pending updates once without waiting and without
     * acknowledging any. A 409 saying the request was terminated by another
     * getUpdates call means another client owns the update stream for this
     * token. A 409 caused by an active webhook is cleared by deleting the
     * webhook.
     */
    void ensureNoOtherInstance() {
        GetUpdates check = GetUpdates.builder()
                .limit(1)
                .timeout(0)
                .build();
        try {
            telegramClient.execute(check);
        } catch (TelegramApiRequestException e) {
            if (e.getErrorCode() == null || e.getErrorCode() != HTTP_CONFLICT) {
                log.warn("[Telegram] Startup instance check rejected ({}), continuing: {}", e.getErrorCode(), e.getMessage());
                return;
            }
            String description = describe(e);
            if (description.contains(CONFLICT_OTHER_POLLER)) {
                log.error("[Telegram] Another instance is already running with this bot token: {}", description);
                throw new DuplicateInstanceException(
                        "Another bot instance is already polling updates with this token", e);
            }
            if (description.contains(CONFLICT_WEBHOOK)) {
                deleteWebhook();
                return;
            }
            log.warn("[Telegram] Startup instance check returned an unrecognized conflict, continuing: {}", description);
        } catch (TelegramApiException e) {
            log.warn("[Telegram] Startup instance check failed, continuing: {}", e.getMessage());
        }
    }

    private void deleteWebhook() {
        log.warn("[Telegram] A webhook is set for this bot token; removing it to use long polling");
        try {
            telegramClient.execute(DeleteWebhook.builder().build());
        } catch (TelegramApiException e) {
            log.warn("[Telegram] Failed to delete webhook: {}", e.getMessage());
        }
    }

    private static String describe(TelegramApiRequestException e) {
        StringBuilder sb = new StringBuilder();
        if (e.getApiResponse() != null) {
            sb.append(e.getApiResponse()).append(' ');
        }
        if (e.getMessage() != null) {
            sb.append(e.getMessage());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running && !conflictMonitor.isConflicted();
    }

    @Override
    public void consume(Update update) {
        try {
            updateExecutor.execute(() -> processUpdate(update));
        } catch (RejectedExecutionException e) {
            log.error("[Telegram] Dispatch rejected for update {}", update.getUpdateId(), e);
        }
    }

    void processUpdate(Update update) {
        try {
            if (update.hasMyChatMember()) {
                handleMembershipChange(update.getMyChatMember());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (Exception e) { // NOSONAR
            log.error("[Telegram] Failed to process update {}", update.getUpdateId(), e);
        }
    }

    private void handleMessage(Message telegramMessage) {
        if (!telegramMessage.hasText() || telegramMessage.getFrom() == null) {
            return;
        }
        long chatId = telegramMessage.getChatId();
        Integer threadId = resolveThreadId(telegramMessage);
        String text = telegramMessage.getText();

        String command = parseCommandName(text);
        if (command != null && commandRouter.hasCommand(command)) {
            handleCommand(telegramMessage, chatId, threadId, command, text);
            return;
        }

        InboundTextMessage message = InboundTextMessage.builder()
                .chatId(chatId)
                .messageId(telegramMessage.getMessageId())
                .threadId(threadId)
                .sender(TelegramUsers.toChatUser(telegramMessage.getFrom()))
                .text(text)
                .build();
        PipelineResult result = messagePipeline.process(message);
        log.debug("[Telegram] Message {} in chat {} finished as {}", message.getMessageId(), chatId,
                result.getState());
    }

    private void handleCommand(Message telegramMessage, long chatId, Integer threadId, String command, String text) {
        String[] parts = text.trim().split("\\s+", 2);
        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].split("\\s+"))
                : List.of();
        long userId = telegramMessage.getFrom().getId();
        CommandResult result = commandRouter.execute(new CommandInvocation(command, args, chatId, userId));
        reply(chatId, threadId, result.output());
    }

    /**
     * Returns the command name of a {@code /cmd} or {@code /cmd@botname} text,
     * or null if the text does not start with one.
     */
    static String parseCommandName(String text) {
        if (!text.startsWith("/")) {
            return null;
        }
        String token = text.split("\\s", 2)[0].substring(1);
        int mention = token.indexOf('@');
        String name = mention >= 0 ? token.substring(0, mention) : token;
        return name.isEmpty() ? null : name;
    }

    private void handleMembershipChange(ChatMemberUpdated update) {
        String newStatus = update.getNewChatMember() != null ? update.getNewChatMember().getStatus() : null;
        String oldStatus = update.getOldChatMember() != null ? update.getOldChatMember().getStatus() : null;
        if (!STATUS_ADMINISTRATOR.equals(newStatus) || STATUS_ADMINISTRATOR.equals(oldStatus)) {
            return;
        }

        long chatId = update.getChat().getId();
        log.info("[AdminSync] Bot promoted to administrator in chat {}", chatId);
        List<ChatUser> added = adminSyncService.syncFromPlatform(chatId);
        if (added.isEmpty()) {
            return;
        }

        List<String> lines = new ArrayList<>();
        lines.add(messageService.getMessage("admin.promoted.notice", String.valueOf(added.size())));
        lines.add("");
        for (ChatUser admin : added) {
            lines.add(messageService.getMessage("command.admin.item", admin.getDisplayIdentity(),
                    String.valueOf(admin.getId())));
        }
        reply(chatId, null, String.join("\n", lines));
    }

    private void reply(long chatId, Integer threadId, String content) {
        chatPlatform.sendMessage(chatId, threadId, content)
                .exceptionally(e -> {
                    log.warn("[Telegram] Failed to reply in chat {}: {}", chatId, e.getMessage());
                    return null;
                });
    }

    private static Integer resolveThreadId(Message message) {
        return Boolean.TRUE.equals(message.getIsTopicMessage()) ? message.getMessageThreadId() : null;
    }
}
