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

package me.golemcore.spoiler.adapter.outbound.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import me.golemcore.spoiler.redaction.RedactedText;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatAdministrators;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram implementation of {@link ChatPlatformPort} on top of the Bot API
 * client.
 *
 * <p>
 * Every call runs asynchronously and completes exceptionally when Telegram
 * rejects it, typically because the bot lacks the needed chat permission.
 * Replies longer than Telegram's 4096 character limit are split at line
 * boundaries; spoiler republications are always sent as one message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramChatPlatformAdapter implements ChatPlatformPort {

    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int SPLIT_LENGTH = 3800;
    private static final String PARSE_MODE_HTML = "HTML";

    private final TelegramClient telegramClient;

    @Override
    public CompletableFuture<Void> deleteMessage(long chatId, int messageId) {
        return CompletableFuture.runAsync(() -> {
            DeleteMessage delete = DeleteMessage.builder()
                    .chatId(String.valueOf(chatId))
                    .messageId(messageId)
                    .build();
            try {
                telegramClient.execute(delete);
                log.debug("[Telegram] Deleted message {} in chat {}", messageId, chatId);
            } catch (TelegramApiException e) {
                throw new RuntimeException("Failed to delete message " + messageId + " in chat " + chatId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendMessage(long chatId, Integer threadId, String content) {
        return CompletableFuture.runAsync(() -> {
            for (String chunk : splitAtNewlines(content, SPLIT_LENGTH)) {
                String formatted = TelegramHtmlFormatter.format(chunk);
                if (formatted.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
                    formatted = formatted.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
                }
                try {
                    telegramClient.execute(buildSendMessage(chatId, threadId, formatted, true));
                } catch (TelegramApiException htmlEx) {
                    // Fallback: retry without formatting if HTML parsing fails
                    log.debug("[Telegram] HTML reply rejected, retrying as plain text: {}", htmlEx.getMessage());
                    try {
                        telegramClient.execute(buildSendMessage(chatId, threadId, chunk, false));
                    } catch (TelegramApiException e) {
                        throw new RuntimeException("Failed to send message to chat " + chatId, e);
                    }
                }
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendSpoilerMessage(long chatId, Integer threadId, RedactedText content) {
        return CompletableFuture.runAsync(() -> {
            try {
                telegramClient.execute(buildSendMessage(chatId, threadId,
                        TelegramHtmlFormatter.formatSpoilers(content), true));
            } catch (TelegramApiException e) {
                throw new RuntimeException("Failed to send spoiler message to chat " + chatId, e);
            }
        });
    }

    @Override
    public int getMaxMessageLength() {
        return TELEGRAM_MAX_MESSAGE_LENGTH;
    }

    @Override
    public CompletableFuture<List<ChatUser>> getChatAdministrators(long chatId) {
        return CompletableFuture.supplyAsync(() -> {
            GetChatAdministrators request = GetChatAdministrators.builder()
                    .chatId(String.valueOf(chatId))
                    .build();
            try {
                List<ChatUser> admins = new ArrayList<>();
                for (ChatMember member : telegramClient.execute(request)) {
                    if (member.getUser() != null) {
                        admins.add(TelegramUsers.toChatUser(member.getUser()));
                    }
                }
                return admins;
            } catch (TelegramApiException e) {
                throw new RuntimeException("Failed to fetch administrators of chat " + chatId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<String>> getChatTitle(long chatId) {
        return CompletableFuture.supplyAsync(() -> {
            GetChat request = GetChat.builder()
                    .chatId(String.valueOf(chatId))
                    .build();
            try {
                return Optional.ofNullable(telegramClient.execute(request).getTitle());
            } catch (TelegramApiException e) {
                throw new RuntimeException("Failed to fetch chat " + chatId, e);
            }
        });
    }

    private static SendMessage buildSendMessage(long chatId, Integer threadId, String text, boolean html) {
        SendMessage.SendMessageBuilder<?, ?> builder = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(text);
        if (threadId != null) {
            builder.messageThreadId(threadId);
        }
        if (html) {
            builder.parseMode(PARSE_MODE_HTML);
        }
        return builder.build();
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength, so that {@code **bold**} or {@code `code`} spans stay intact.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            // Hard split as last resort
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }
}
