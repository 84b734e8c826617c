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

import java.util.ArrayList;
import java.util.List;

/**
 * Redacted text together with the spoiler spans the rewriter produced.
 *
 * <p>
 * Each span covers a marked occurrence including its two markers. Only these
 * spans are rendered as spoilers; any other {@code |} in the text is shown
 * literally.
 *
 * @param text
 *            text with markers around every redacted occurrence
 * @param spans
 *            marked regions, ascending and non-overlapping
 */
public record RedactedText(String text, List<Span> spans) {

    public RedactedText {
        spans = List.copyOf(spans);
    }

    public static RedactedText plain(String text) {
        return new RedactedText(text, List.of());
    }

    /**
     * Returns the same redaction with {@code prefix} prepended to the text.
     */
    public RedactedText withPrefix(String prefix) {
        List<Span> shifted = new ArrayList<>(spans.size());
        for (Span span : spans) {
            shifted.add(new Span(span.start() + prefix.length(), span.end() + prefix.length()));
        }
        return new RedactedText(prefix + text, shifted);
    }

    /**
     * Length of the text as readers see it, markers excluded.
     */
    public int visibleLength() {
        return text.length() - spans.size() * 2 * SpoilerMarkup.MARKER.length();
    }

    /**
     * A marked region.
     *
     * @param start
     *            index of the opening marker
     * @param end
     *            index just past the closing marker
     */
    public record Span(int start, int end) {

        /**
         * Returns the hidden text between the markers.
         */
        public String content(String text) {
            return text.substring(start + SpoilerMarkup.MARKER.length(), end - SpoilerMarkup.MARKER.length());
        }
    }
}
