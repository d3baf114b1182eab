package me.golemcore.adminbot.infrastructure.i18n;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized texts shown to Discord users.
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}; English is the
 * fallback. Parametric messages use {@link MessageFormat} syntax. A key missing
 * in every bundle is returned as-is.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService() {
        for (String lang : SUPPORTED_LANGUAGES) {
            try {
                bundles.put(lang, ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang)));
            } catch (MissingResourceException e) {
                log.warn("Failed to load message bundle for language: {}", lang);
            }
        }
    }

    /**
     * Get message in the configured language.
     */
    public String getMessage(String key, Object... args) {
        return getMessageForLanguage(key, language, args);
    }

    /**
     * Get message in an explicit language, falling back to English.
     */
    public String getMessageForLanguage(String key, String lang, Object... args) {
        ResourceBundle bundle = bundles.getOrDefault(lang, bundles.get(DEFAULT_LANG));
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
            log.warn("Missing message key: {} for language: {}", key, lang);
            return key;
        }
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String lang) {
        if (SUPPORTED_LANGUAGES.contains(lang)) {
            language = lang;
        } else {
            log.warn("Unsupported language: {}, using default", lang);
            language = DEFAULT_LANG;
        }
    }

    public boolean isSupported(String lang) {
        return SUPPORTED_LANGUAGES.contains(lang);
    }
}
