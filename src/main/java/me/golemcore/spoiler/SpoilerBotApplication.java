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

package me.golemcore.spoiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Spoiler Bot.
 *
 * <p>
 * The bot watches Telegram group chats and, when a message contains one of the
 * keywords configured for that chat, deletes it and republishes it with the
 * keywords hidden behind spoiler tags, attributed to the original author.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter, SystemController
 * Domain Layer       → MessagePipeline, ConfigStore, AdminSyncService
 * Infrastructure     → LocalStorageAdapter, MessageService, BotProperties
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix. The bot token is read from {@code TELEGRAM_BOT_TOKEN}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SpoilerBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpoilerBotApplication.class, args);
    }

}
