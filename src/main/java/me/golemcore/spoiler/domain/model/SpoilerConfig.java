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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk representation of the bot configuration.
 *
 * <pre>
 * {
 *   "spoiler_keywords": { "&lt;chat_id&gt;": ["kw1", "kw2"] },
 *   "case_sensitive": false,
 *   "admin_users": [123],
 *   "enabled_chats": [-100123]
 * }
 * </pre>
 *
 * Chat ids are JSON object keys and therefore strings in the keyword map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpoilerConfig {

    @JsonProperty("spoiler_keywords")
    @Builder.Default
    private Map<String, List<String>> spoilerKeywords = new LinkedHashMap<>();

    @JsonProperty("case_sensitive")
    private boolean caseSensitive;

    @JsonProperty("admin_users")
    @Builder.Default
    private List<Long> adminUsers = new ArrayList<>();

    @JsonProperty("enabled_chats")
    @Builder.Default
    private List<Long> enabledChats = new ArrayList<>();
}
