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

package me.golemcore.spoiler.port.outbound;

import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.redaction.RedactedText;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for actions the bot performs on the chat platform. Every call
 * is asynchronous and may fail (missing rights, network errors); callers treat
 * a failed future as a normal outcome, not as a crash.
 */
public interface ChatPlatformPort {

    /**
     * Deletes a message from a chat.
     */
    CompletableFuture<Void> deleteMessage(long chatId, int messageId);

    /**
     * Sends a bot reply written in the bot's Markdown subset (bold, inline code).
     *
     * @param threadId
     *            forum topic to post into, or {@code null} for the main thread
     */
    CompletableFuture<Void> sendMessage(long chatId, Integer threadId, String content);

    /**
     * Sends user-authored text as one message in which only the redaction's
     * spans are rendered as spoilers; every other character is delivered
     * literally.
     *
     * @param threadId
     *            forum topic to post into, or {@code null} for the main thread
     */
    CompletableFuture<Void> sendSpoilerMessage(long chatId, Integer threadId, RedactedText content);

    /**
     * Longest message text the platform accepts, counted in UTF-16 code units
     * of the rendered text.
     */
    int getMaxMessageLength();

    /**
     * Fetches the chat's current administrators, including bot accounts.
     */
    CompletableFuture<List<ChatUser>> getChatAdministrators(long chatId);

    /**
     * Fetches the chat title, empty for private chats or when unavailable.
     */
    CompletableFuture<Optional<String>> getChatTitle(long chatId);
}
