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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.spoiler.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the Telegram channel.
 *
 * <p>
 * Creates the long polling application, the Bot API client and the pool that
 * processes updates off the polling thread. The polling HTTP client carries a
 * {@link PollingConflictMonitor}. A missing token fails startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TelegramConfig {

    public static final String UPDATE_EXECUTOR = "telegramUpdateExecutor";

    private final BotProperties properties;

    @Bean
    public PollingConflictMonitor pollingConflictMonitor() {
        return new PollingConflictMonitor(properties.getTelegram().getConflictThreshold());
    }

    @Bean
    public TelegramBotsLongPollingApplication telegramBotsApplication(PollingConflictMonitor conflictMonitor) {
        return new TelegramBotsLongPollingApplication(ObjectMapper::new, () -> new OkHttpClient.Builder()
                .connectTimeout(75, TimeUnit.SECONDS)
                .writeTimeout(70, TimeUnit.SECONDS)
                .readTimeout(100, TimeUnit.SECONDS)
                .addInterceptor(conflictMonitor)
                .build());
    }

    @Bean
    public TelegramClient telegramClient() {
        return new OkHttpTelegramClient(requireToken(properties));
    }

    @Bean(name = UPDATE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService telegramUpdateExecutor() {
        int threads = Math.max(1, properties.getTelegram().getDispatchThreads());
        log.info("[Telegram] Update dispatch pool: {} thread(s)", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("telegram-update-"));
    }

    static String requireToken(BotProperties properties) {
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException(
                    "Telegram bot token is not configured: set TELEGRAM_BOT_TOKEN or bot.telegram.token");
        }
        return token.trim();
    }
}
