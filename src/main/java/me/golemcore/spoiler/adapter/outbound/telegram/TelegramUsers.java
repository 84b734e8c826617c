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

import me.golemcore.spoiler.domain.model.ChatUser;
import org.telegram.telegrambots.meta.api.objects.User;

/**
 * Maps Telegram users to the domain's {@link ChatUser}.
 */
public final class TelegramUsers {

    private TelegramUsers() {
    }

    public static ChatUser toChatUser(User user) {
        return ChatUser.builder()
                .id(user.getId())
                .username(user.getUserName())
                .firstName(user.getFirstName())
                .bot(Boolean.TRUE.equals(user.getIsBot()))
                .build();
    }
}
