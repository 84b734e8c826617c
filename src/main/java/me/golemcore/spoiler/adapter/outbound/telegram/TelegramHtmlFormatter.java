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

import me.golemcore.spoiler.redaction.RedactedText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts outgoing text to Telegram-compatible HTML.
 *
 * <p>
 * Two inputs are handled:
 * <ul>
 * <li>Bot replies written in a small Markdown subset: {@code **bold**} and
 * {@code `inline code`}
 * <li>Republished user text, where only the spans produced by redaction become
 * {@code <tg-spoiler>} and everything else, stray {@code ||} included, is shown
 * literally
 * </ul>
 *
 * <p>
 * HTML entities are always escaped so user text can never inject markup.
 */
public final class TelegramHtmlFormatter {

    private TelegramHtmlFormatter() {
    }

    // `inline code`
    private static final Pattern INLINE_CODE_PATTERN = Pattern.compile(
            "`([^`\n]+)`");

    // **bold**
    private static final Pattern BOLD_PATTERN = Pattern.compile(
            "\\*\\*(.+?)\\*\\*");

    private static final String INLINE_CODE_PLACEHOLDER = "\uE000IC";

    /**
     * Convert a bot reply to Telegram HTML.
     */
    public static String format(String text) {
        if (text == null || text.isBlank())
            return text;

        // Extract inline code to protect its content from formatting
        List<String> inlineCodes = new ArrayList<>();
        Matcher m = INLINE_CODE_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            inlineCodes.add(m.group(1));
            m.appendReplacement(sb, INLINE_CODE_PLACEHOLDER + (inlineCodes.size() - 1) + INLINE_CODE_PLACEHOLDER);
        }
        m.appendTail(sb);
        text = sb.toString();

        text = escapeHtml(text);

        text = BOLD_PATTERN.matcher(text).replaceAll(
                mr -> Matcher.quoteReplacement("<b>" + mr.group(1) + "</b>"));

        // Restore inline code (with HTML escaping)
        for (int i = 0; i < inlineCodes.size(); i++) {
            text = text.replace(
                    INLINE_CODE_PLACEHOLDER + i + INLINE_CODE_PLACEHOLDER,
                    "<code>" + escapeHtml(inlineCodes.get(i)) + "</code>");
        }

        return text.strip();
    }

    /**
     * Convert redacted user text to Telegram HTML. Text outside the redaction's
     * spans is escaped and sent as typed.
     */
    public static String formatSpoilers(RedactedText redacted) {
        String text = redacted.text();
        if (text == null || text.isEmpty())
            return text;

        StringBuilder out = new StringBuilder(text.length() + 32);
        int last = 0;
        for (RedactedText.Span span : redacted.spans()) {
            out.append(escapeHtml(text.substring(last, span.start())))
                    .append("<tg-spoiler>")
                    .append(escapeHtml(span.content(text)))
                    .append("</tg-spoiler>");
            last = span.end();
        }
        out.append(escapeHtml(text.substring(last)));
        return out.toString();
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
