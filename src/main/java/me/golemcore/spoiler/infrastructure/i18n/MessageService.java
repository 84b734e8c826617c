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

package me.golemcore.spoiler.infrastructure.i18n;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized bot replies.
 *
 * <p>
 * Messages are loaded from the {@code messages.properties} resource bundle and
 * support parametric messages using {@link MessageFormat} syntax. If a key is
 * missing, the key itself is returned so the reply still carries some meaning.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    private static final String BUNDLE_NAME = "messages";

    private final ResourceBundle bundle;

    public MessageService() {
        this.bundle = loadBundle();
    }

    private static ResourceBundle loadBundle() {
        try {
            ResourceBundle loaded = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
            log.info("Loaded message bundle: {}", BUNDLE_NAME);
            return loaded;
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle: {}", BUNDLE_NAME);
            return null;
        }
    }

    /**
     * Get message by key, formatting the optional arguments into it.
     */
    public String getMessage(String key, Object... args) {
        if (bundle == null) {
            return key;
        }
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return MessageFormat.format(message, args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {}", key);
            return key;
        }
    }
}
