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

package me.golemcore.spoiler.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.service.ConfigStore;
import me.golemcore.spoiler.port.inbound.ChannelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring auto-configuration that initializes and starts the bot on application
 * startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Seeds the administrator set from {@code bot.telegram.initial-admin-id}
 * before any update is processed</li>
 * <li>Starts all input channels; a channel that refuses to start (for example
 * because another instance already polls with the same token) aborts
 * startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final ConfigStore configStore;
    private final List<ChannelPort> channelPorts;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Spoiler Bot v{} starting...", version);
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        seedInitialAdmin(properties.getTelegram().getInitialAdminId());

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("Spoiler Bot started successfully");
    }

    void seedInitialAdmin(String initialAdminId) {
        if (initialAdminId == null || initialAdminId.isBlank()) {
            return;
        }
        long userId;
        try {
            userId = Long.parseLong(initialAdminId.trim());
        } catch (NumberFormatException e) {
            log.warn("[Config] Ignoring non-numeric initial administrator id: '{}'", initialAdminId);
            return;
        }
        if (configStore.addAdmin(userId)) {
            log.info("[Config] Seeded initial administrator {}", userId);
        }
    }
}
