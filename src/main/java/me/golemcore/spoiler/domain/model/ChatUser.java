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

package me.golemcore.spoiler.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * A chat platform user as seen by the bot: message senders and chat
 * administrators.
 */
@Data
@Builder
public class ChatUser {

    private long id;
    private String username;
    private String firstName;
    private boolean bot;

    /**
     * Returns the name used to attribute republished messages: {@code @handle}
     * when the user has one, otherwise the first name, otherwise the numeric id.
     */
    public String getDisplayIdentity() {
        if (username != null && !username.isBlank()) {
            return "@" + username;
        }
        if (firstName != null && !firstName.isBlank()) {
            return firstName;
        }
        return String.valueOf(id);
    }
}
