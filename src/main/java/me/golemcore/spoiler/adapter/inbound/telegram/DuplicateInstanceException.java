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

/**
 * Thrown when Telegram reports that another client is already polling updates
 * with this bot's token. Two instances would redact the same messages twice, so
 * the process must not keep running.
 */
public class DuplicateInstanceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DuplicateInstanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
