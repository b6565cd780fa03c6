package com.example.audiobook.adapters.preferences;

import com.example.audiobook.adapters.PreferenceStore;
import com.example.audiobook.utils.model.NamingPattern;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Preference store persisted as a properties file. The file is read on first access and
 * rewritten on every change.
 */
@Slf4j
public class PropertiesPreferenceStore implements PreferenceStore {
    static final String RESTRICTED_ONLY = "restrictedOnly";
    static final String NAMING_PATTERN = "namingPattern";
    static final String COMPANION_COVER = "companionCover";
    static final String MANUALLY_PAUSED = "manuallyPaused";
    private static final String ITEM_SEPARATOR = ",";

    private final Path file;
    private Properties properties;

    public PropertiesPreferenceStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized boolean isRestrictedOnly() {
        return Boolean.parseBoolean(load().getProperty(RESTRICTED_ONLY, "false"));
    }

    @Override
    public synchronized void setRestrictedOnly(boolean restrictedOnly) {
        update(RESTRICTED_ONLY, String.valueOf(restrictedOnly));
    }

    @Override
    public synchronized NamingPattern getNamingPattern() {
        return NamingPattern.fromKey(load().getProperty(NAMING_PATTERN, NamingPattern.AUTHOR_SERIES_BOOK.getKey()));
    }

    @Override
    public synchronized void setNamingPattern(NamingPattern namingPattern) {
        update(NAMING_PATTERN, namingPattern.getKey());
    }

    @Override
    public synchronized boolean isCompanionCoverEnabled() {
        return Boolean.parseBoolean(load().getProperty(COMPANION_COVER, "false"));
    }

    @Override
    public synchronized void setCompanionCoverEnabled(boolean enabled) {
        update(COMPANION_COVER, String.valueOf(enabled));
    }

    @Override
    public synchronized Set<String> getManuallyPaused() {
        String value = load().getProperty(MANUALLY_PAUSED, "");
        if (value.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(value.split(ITEM_SEPARATOR))
                .map(String::trim)
                .filter(e -> !e.isEmpty())
                .map(PropertiesPreferenceStore::decodeItemId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public synchronized void setManuallyPaused(Set<String> itemIds) {
        update(MANUALLY_PAUSED, itemIds.stream()
                .map(e -> URLEncoder.encode(e, StandardCharsets.UTF_8))
                .collect(Collectors.joining(ITEM_SEPARATOR)));
    }

    // ids are url encoded so the separator can never occur within a stored id
    private static String decodeItemId(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Keeping malformed manual pause entry {} as is", value);
            return value;
        }
    }

    private Properties load() {
        if (properties != null) {
            return properties;
        }

        properties = new Properties();
        if (!Files.exists(file)) {
            log.info("No preferences file found, creating {} with defaults", file.toAbsolutePath());
            try {
                save();
            } catch (UncheckedIOException e) {
                log.warn("Unable to create preferences file {}: {}", file, e.getMessage());
            }
            return properties;
        }

        try (InputStream input = Files.newInputStream(file)) {
            properties.load(input);
            log.debug("Loaded preferences from {}", file.toAbsolutePath());
        } catch (IOException e) {
            log.error("Error loading preferences from {}, using defaults", file, e);
        }
        return properties;
    }

    // the in-memory value is restored when the change could not be persisted
    private void update(String key, String value) {
        Properties current = load();
        String previous = current.getProperty(key);
        current.setProperty(key, value);
        try {
            save();
        } catch (UncheckedIOException e) {
            if (previous == null) {
                current.remove(key);
            } else {
                current.setProperty(key, previous);
            }
            throw e;
        }
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(file)) {
                properties.store(output, "Audiobook pipeline preferences");
            }
            log.debug("Preferences saved to {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save preferences", e);
        }
    }
}
