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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read snapshot of one chat's effective configuration, taken atomically so the
 * keyword set and the case mode always belong together.
 *
 * @param chatId
 *            chat the snapshot belongs to
 * @param keywords
 *            the chat's keywords in insertion order, empty when none are
 *            configured
 * @param enabled
 *            whether spoiler detection is enabled in the chat
 * @param caseSensitive
 *            process-wide case mode at the time of the snapshot
 */
public record ChatConfig(long chatId, Set<String> keywords, boolean enabled, boolean caseSensitive) {

    public ChatConfig {
        keywords = keywords != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(keywords))
                : Set.of();
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }
}
