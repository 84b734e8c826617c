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

package me.golemcore.spoiler.domain.pipeline;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.ChatConfig;
import me.golemcore.spoiler.domain.model.InboundTextMessage;
import me.golemcore.spoiler.domain.model.PipelineResult;
import me.golemcore.spoiler.domain.model.PipelineResult.SkipReason;
import me.golemcore.spoiler.domain.model.PipelineState;
import me.golemcore.spoiler.domain.service.ConfigStore;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import me.golemcore.spoiler.infrastructure.i18n.MessageService;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import me.golemcore.spoiler.redaction.KeywordMatcher;
import me.golemcore.spoiler.redaction.RedactedText;
import me.golemcore.spoiler.redaction.RedactionRewriter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Moderates one plain-text message from receipt to final outcome.
 *
 * <p>
 * Processing stages:
 * <ol>
 * <li>Gate: the chat must be enabled and have keywords of its own</li>
 * <li>Match: the chat's keywords are searched in the text</li>
 * <li>Rewrite: matches are wrapped in spoiler markers and the sender's display
 * identity is prefixed</li>
 * <li>Republish: the original is deleted, then the rewritten text is posted to
 * the same thread</li>
 * </ol>
 *
 * <p>
 * If deleting or posting fails the run ends {@link PipelineState#DEGRADED}:
 * nothing is retried and exactly one permission warning is sent to the thread.
 * A failed delete stops the run before anything is posted. A rewrite longer
 * than the platform's message limit is not republished at all: the original
 * stays, the run ends DEGRADED and the chat is told why. Outbound calls are
 * bounded by {@code bot.telegram.request-timeout-seconds}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessagePipeline {

    private static final String ATTRIBUTION_SEPARATOR = ": ";
    private static final int PREVIEW_LENGTH = 50;

    private final ConfigStore configStore;
    private final KeywordMatcher keywordMatcher;
    private final RedactionRewriter redactionRewriter;
    private final ChatPlatformPort chatPlatform;
    private final MessageService messageService;
    private final long requestTimeoutSeconds;

    public MessagePipeline(ConfigStore configStore, KeywordMatcher keywordMatcher,
            RedactionRewriter redactionRewriter, ChatPlatformPort chatPlatform,
            MessageService messageService, BotProperties properties) {
        this.configStore = configStore;
        this.keywordMatcher = keywordMatcher;
        this.redactionRewriter = redactionRewriter;
        this.chatPlatform = chatPlatform;
        this.messageService = messageService;
        this.requestTimeoutSeconds = Math.max(1, properties.getTelegram().getRequestTimeoutSeconds());
    }

    public PipelineResult process(InboundTextMessage message) {
        long chatId = message.getChatId();
        trace(message, PipelineState.RECEIVED);

        String text = message.getText();
        if (text == null || text.isBlank()) {
            return skip(message, SkipReason.NO_TEXT);
        }

        ChatConfig chat = configStore.getChatConfig(chatId);
        trace(message, PipelineState.GATE_CHECKED);
        if (!chat.enabled()) {
            return skip(message, SkipReason.CHAT_DISABLED);
        }
        if (!chat.hasKeywords()) {
            return skip(message, SkipReason.NO_KEYWORDS);
        }

        List<String> matched = keywordMatcher.findMatches(text, chat.keywords(), chat.caseSensitive());
        if (matched.isEmpty()) {
            return skip(message, SkipReason.NO_MATCH);
        }
        trace(message, PipelineState.MATCHED);

        RedactedText republished = redactionRewriter.rewrite(text, matched, chat.caseSensitive())
                .withPrefix(message.getSender().getDisplayIdentity() + ATTRIBUTION_SEPARATOR);
        trace(message, PipelineState.REWRITTEN);

        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
                .matchedKeywords(matched)
                .republishedText(republished.text());

        int limit = chatPlatform.getMaxMessageLength();
        if (republished.visibleLength() > limit) {
            log.warn("[Pipeline] Rewrite of message {} in chat {} exceeds {} characters, original kept",
                    message.getMessageId(), chatId, limit);
            sendWarning(message, messageService.getMessage("pipeline.warning.too-long", String.valueOf(limit)));
            return result.state(PipelineState.DEGRADED).originalDeleted(false).build();
        }

        trace(message, PipelineState.REPUBLISH_ATTEMPTED);
        boolean deleted = await(chatPlatform.deleteMessage(chatId, message.getMessageId()), "delete", message);
        boolean posted = deleted
                && await(chatPlatform.sendSpoilerMessage(chatId, message.getThreadId(), republished), "repost",
                        message);

        if (posted) {
            log.info("[Pipeline] Redacted message {} in chat {}: keywords={}", message.getMessageId(), chatId,
                    matched);
            return result.state(PipelineState.SUCCEEDED).originalDeleted(true).build();
        }

        log.warn("[Pipeline] Republish failed for message {} in chat {} (deleted={})", message.getMessageId(),
                chatId, deleted);
        sendWarning(message, messageService.getMessage("pipeline.warning.permissions"));
        return result.state(PipelineState.DEGRADED).originalDeleted(deleted).build();
    }

    private void sendWarning(InboundTextMessage message, String warning) {
        if (!await(chatPlatform.sendMessage(message.getChatId(), message.getThreadId(), warning), "warning",
                message)) {
            log.error("[Pipeline] Could not deliver warning to chat {}", message.getChatId());
        }
    }

    private boolean await(CompletableFuture<?> future, String step, InboundTextMessage message) {
        try {
            future.orTimeout(requestTimeoutSeconds, TimeUnit.SECONDS).join();
            return true;
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Pipeline] Step '{}' failed for message {} in chat {}: {}", step, message.getMessageId(),
                    message.getChatId(), cause.toString());
            return false;
        }
    }

    private PipelineResult skip(InboundTextMessage message, SkipReason reason) {
        log.debug("[Pipeline] chat={} message={} -> SKIPPED ({})", message.getChatId(), message.getMessageId(),
                reason);
        return PipelineResult.skipped(reason);
    }

    private void trace(InboundTextMessage message, PipelineState state) {
        if (log.isDebugEnabled()) {
            log.debug("[Pipeline] chat={} message={} -> {} \"{}\"", message.getChatId(), message.getMessageId(),
                    state, preview(message.getText()));
        }
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
