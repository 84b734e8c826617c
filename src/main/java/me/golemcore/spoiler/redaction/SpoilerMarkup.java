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

/**
 * The {@code ||hidden||} spoiler marker used in republished messages.
 *
 * <p>
 * Only an occurrence whose markers sit directly around it counts as marked.
 * Markers are never paired across arbitrary text: a stray {@code ||} typed by
 * a user is just two characters.
 */
public final class SpoilerMarkup {

    public static final String MARKER = "||";

    private SpoilerMarkup() {
    }

    /**
     * Wraps text in spoiler markers.
     */
    public static String wrap(String text) {
        return MARKER + text + MARKER;
    }

    /**
     * Returns true if {@code text[start, end)} is immediately preceded and
     * followed by a marker.
     */
    public static boolean isWrapped(String text, int start, int end) {
        return start >= MARKER.length()
                && text.startsWith(MARKER, start - MARKER.length())
                && text.startsWith(MARKER, end);
    }
}
