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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Hides matched keywords behind spoiler markers.
 *
 * <p>
 * Every whole-word occurrence of each keyword is wrapped as
 * {@code ||occurrence||}, keeping the casing the author typed. An occurrence
 * that already has markers directly around it is kept as it is and counts as a
 * spoiler span, so redacting a redacted text changes nothing. Keywords are
 * applied in the given order; an occurrence overlapping a span taken by an
 * earlier keyword is left inside that span. Text outside the matched
 * occurrences is never altered.
 *
 * @since 1.0
 * @see KeywordMatcher
 */
@Component
@RequiredArgsConstructor
public class RedactionRewriter {

    private final KeywordMatcher keywordMatcher;

    /**
     * Wraps every occurrence of the matched keywords in {@code text}.
     */
    public String redact(String text, List<String> matchedKeywords, boolean caseSensitive) {
        if (text == null) {
            return null;
        }
        return rewrite(text, matchedKeywords, caseSensitive).text();
    }

    /**
     * Wraps every occurrence of the matched keywords and reports the resulting
     * spoiler spans.
     */
    public RedactedText rewrite(String text, List<String> matchedKeywords, boolean caseSensitive) {
        if (text.isEmpty() || matchedKeywords == null || matchedKeywords.isEmpty()) {
            return RedactedText.plain(text);
        }

        List<Occurrence> accepted = new ArrayList<>();
        for (String keyword : matchedKeywords) {
            if (keyword == null || keyword.isEmpty()) {
                continue;
            }
            Matcher m = keywordMatcher.patternFor(keyword, caseSensitive).matcher(text);
            while (m.find()) {
                Occurrence occurrence = select(text, m.start(), m.end(), accepted);
                if (occurrence != null) {
                    accepted.add(occurrence);
                }
            }
        }
        if (accepted.isEmpty()) {
            return RedactedText.plain(text);
        }
        accepted.sort(Comparator.comparingInt(Occurrence::from));

        StringBuilder sb = new StringBuilder(text.length() + accepted.size() * 4);
        List<RedactedText.Span> spans = new ArrayList<>(accepted.size());
        int last = 0;
        for (Occurrence occurrence : accepted) {
            sb.append(text, last, occurrence.from());
            int spanStart = sb.length();
            String matched = text.substring(occurrence.from(), occurrence.to());
            sb.append(occurrence.alreadyWrapped() ? matched : SpoilerMarkup.wrap(matched));
            spans.add(new RedactedText.Span(spanStart, sb.length()));
            last = occurrence.to();
        }
        sb.append(text, last, text.length());
        return new RedactedText(sb.toString(), spans);
    }

    private static Occurrence select(String text, int start, int end, List<Occurrence> accepted) {
        if (SpoilerMarkup.isWrapped(text, start, end)) {
            int marker = SpoilerMarkup.MARKER.length();
            Occurrence wrapped = new Occurrence(start - marker, end + marker, true);
            if (!overlapsAny(accepted, wrapped)) {
                return wrapped;
            }
        }
        Occurrence bare = new Occurrence(start, end, false);
        return overlapsAny(accepted, bare) ? null : bare;
    }

    private static boolean overlapsAny(List<Occurrence> accepted, Occurrence candidate) {
        for (Occurrence occurrence : accepted) {
            if (candidate.from() < occurrence.to() && occurrence.from() < candidate.to()) {
                return true;
            }
        }
        return false;
    }

    private record Occurrence(int from, int to, boolean alreadyWrapped) {
    }
}
