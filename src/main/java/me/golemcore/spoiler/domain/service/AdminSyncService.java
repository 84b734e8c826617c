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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.ChatUser;
import me.golemcore.spoiler.port.outbound.ChatPlatformPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports a chat's platform administrators into the bot administrator set.
 *
 * <p>
 * Bot accounts and users who already are bot administrators are skipped.
 * Nobody is ever removed: administrators demoted on the platform keep their bot
 * privileges.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminSyncService {

    private final ChatPlatformPort chatPlatform;
    private final ConfigStore configStore;

    /**
     * Fetches the chat's administrators and registers the new ones.
     *
     * @return users that became bot administrators, in platform order
     * @throws java.util.concurrent.CompletionException
     *             if the administrator list cannot be fetched
     */
    public List<ChatUser> syncFromPlatform(long chatId) {
        List<ChatUser> platformAdmins = chatPlatform.getChatAdministrators(chatId).join();

        Map<Long, ChatUser> candidates = new LinkedHashMap<>();
        for (ChatUser user : platformAdmins) {
            if (user == null || user.isBot() || configStore.isAdmin(user.getId())) {
                continue;
            }
            candidates.putIfAbsent(user.getId(), user);
        }
        if (candidates.isEmpty()) {
            log.debug("[AdminSync] chat={} no new administrators among {}", chatId, platformAdmins.size());
            return List.of();
        }

        List<Long> added = configStore.addAdmins(candidates.keySet());
        List<ChatUser> result = added.stream().map(candidates::get).toList();
        log.info("[AdminSync] chat={} added {} administrator(s): {}", chatId, result.size(), added);
        return result;
    }
}
