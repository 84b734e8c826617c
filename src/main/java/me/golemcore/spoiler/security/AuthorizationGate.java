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

package me.golemcore.spoiler.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spoiler.domain.model.AdminAddOutcome;
import me.golemcore.spoiler.domain.service.ConfigStore;
import org.springframework.stereotype.Component;

/**
 * Decides which users may run privileged commands.
 *
 * <p>
 * A user may manage the bot when they are in the bot administrator set. The
 * only exception is registering administrators: while the set is empty anyone
 * may add one, so the first administrator can register themselves. Once the
 * set is non-empty only existing administrators may add more.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthorizationGate {

    private final ConfigStore configStore;

    /**
     * Check if a user may edit keywords, toggle chats and case mode, or sync
     * administrators.
     */
    public boolean canManage(long userId) {
        boolean allowed = configStore.isAdmin(userId);
        if (!allowed) {
            log.warn("[Security] Unauthorized: user={}", userId);
        }
        return allowed;
    }

    /**
     * Check if a user may register a new administrator right now.
     */
    public boolean canAddAdmin(long userId) {
        return !configStore.hasAdministrators() || configStore.isAdmin(userId);
    }

    /**
     * Registers {@code newAdminId} on behalf of {@code requesterId}, applying the
     * bootstrap rule atomically so that two concurrent first requests cannot both
     * pass the empty-set check.
     */
    public AdminAddOutcome addAdmin(long requesterId, long newAdminId) {
        AdminAddOutcome outcome = configStore.addAdminIf(newAdminId,
                admins -> admins.isEmpty() || admins.contains(requesterId));
        if (outcome == AdminAddOutcome.DENIED) {
            log.warn("[Security] Admin registration denied: requester={}, target={}", requesterId, newAdminId);
        }
        return outcome;
    }
}
