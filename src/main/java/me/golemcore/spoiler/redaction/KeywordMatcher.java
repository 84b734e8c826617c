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

package me.golemcore.spoiler.redaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Finds which of a chat's keywords occur in a message.
 *
 * <p>
 * A keyword matches only as a whole word: the characters directly before and
 * after an occurrence must not be word characters (Unicode-aware), so
 * {@code end} does not match inside {@code endgame}. Keyword text is always
 * taken literally, never as pattern syntax. Incoming text carries no rendered
 * spoilers, so a keyword between {@code ||} typed by the author still counts.
 *
 * <p>
 * Compiled patterns are cached per keyword and case mode.
 *
 * @since 1.0
 * @see RedactionRewriter
 */
@Component
@Slf4j
public class KeywordMatcher {

    private static final int MAX_CACHED_PATTERNS = 10_000;

    private final Map<PatternKey, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * Returns the keywords that occur in {@code text}, in the iteration order of
     * {@code keywords}.
     *
     * @param text
     *            message text
     * @param keywords
     *            keywords configured for the message's own chat
     * @param caseSensitive
     *            whether comparison is exact
     */
    public List<String> findMatches(String text, Collection<String> keywords, boolean caseSensitive) {
        if (keywords == null || keywords.isEmpty() || text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isEmpty()) {
                continue;
            }
            if (patternFor(keyword, caseSensitive).matcher(text).find()) {
                found.add(keyword);
            }
        }
        return found;
    }

    /**
     * Returns the whole-word pattern for a keyword.
     */
    Pattern patternFor(String keyword, boolean caseSensitive) {
        PatternKey key = new PatternKey(keyword, caseSensitive);
        Pattern cached = patternCache.get(key);
        if (cached != null) {
            return cached;
        }
        if (patternCache.size() >= MAX_CACHED_PATTERNS) {
            log.debug("[Matcher] Pattern cache full, clearing");
            patternCache.clear();
        }
        return patternCache.computeIfAbsent(key, k -> compile(k.keyword(), k.caseSensitive()));
    }

    static Pattern compile(String keyword, boolean caseSensitive) {
        int flags = Pattern.UNICODE_CHARACTER_CLASS;
        if (!caseSensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return Pattern.compile("(?<!\\w)" + Pattern.quote(keyword) + "(?!\\w)", flags);
    }

    private record PatternKey(String keyword, boolean caseSensitive) {
    }
}
