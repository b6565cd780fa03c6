package com.example.audiobook.adapters.metadata;

import com.example.audiobook.adapters.MetadataStore;
import com.example.audiobook.utils.model.BookMetadata;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view on a library snapshot stored as a JSON array of books. The file is re-read on
 * every lookup, so library syncs are picked up without a restart.
 */
@Slf4j
public class JsonMetadataStore implements MetadataStore {
    private final Path libraryFile;
    private final ObjectMapper objectMapper;

    public JsonMetadataStore(Path libraryFile) {
        this.libraryFile = libraryFile;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Optional<BookMetadata> getMetadataByExternalId(String externalId) {
        Objects.requireNonNull(externalId, "externalId cannot be null");
        if (!Files.exists(libraryFile)) {
            log.warn("Library file {} not found, no metadata for {}", libraryFile.toAbsolutePath(), externalId);
            return Optional.empty();
        }

        try {
            List<BookMetadata> books = objectMapper.readValue(libraryFile.toFile(), new TypeReference<>() {});
            return books.stream()
                    .filter(e -> externalId.equals(e.getExternalId()))
                    .findFirst();
        } catch (Exception e) {
            log.error("Error reading library file {}: {}", libraryFile, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
