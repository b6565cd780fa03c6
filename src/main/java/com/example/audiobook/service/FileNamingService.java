package com.example.audiobook.service;

import com.example.audiobook.exception.PathResolutionException;
import com.example.audiobook.utils.constants.RegexPatterns;
import com.example.audiobook.utils.model.BookMetadata;
import com.example.audiobook.utils.model.ConversionContext;
import com.example.audiobook.utils.model.NamingPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the destination-relative path of an audiobook from the user's naming pattern.
 * Segments are always separated by {@code /}.
 */
@Slf4j
@Service
public class FileNamingService {
    static final String EXTENSION = ".m4b";
    static final String UNKNOWN_AUTHOR = "Unknown Author";
    static final int MAX_COMPONENT_LENGTH = 255;

    /**
     * Resolve the relative path, falling back to {@code {itemId}.m4b} on any failure.
     */
    public String resolveOrFallback(ConversionContext context, NamingPattern pattern) {
        try {
            return resolve(context, pattern);
        } catch (PathResolutionException | RuntimeException e) {
            log.warn("Failed to build file path for {}: {}, using fallback", context.getItemId(), e.getMessage());
            return sanitizeFileName(context.getItemId() + EXTENSION);
        }
    }

    public String resolve(ConversionContext context, NamingPattern pattern) throws PathResolutionException {
        BookMetadata metadata = context.getMetadata()
                .orElseThrow(() -> new PathResolutionException("No metadata available for " + context.getItemId()));
        if (metadata.getTitle() == null || metadata.getTitle().isBlank()) {
            throw new PathResolutionException("No title available for " + context.getItemId());
        }

        String title = metadata.getTitle().trim();
        String fileName = sanitizeFileName(title + EXTENSION);
        List<String> directories = new ArrayList<>();

        switch (pattern) {
            case FLAT_FILE -> {
            }
            case AUTHOR_BOOK_FOLDER -> {
                directories.add(firstAuthor(metadata));
                directories.add(title);
            }
            case AUTHOR_SERIES_BOOK -> {
                directories.add(firstAuthor(metadata));
                if (metadata.getSeriesName() != null && !metadata.getSeriesName().isBlank()) {
                    directories.add(metadata.getSeriesName().trim());
                }
                directories.add(title);
            }
        }

        List<String> segments = new ArrayList<>();
        directories.forEach(e -> segments.add(sanitizePathComponent(e)));
        segments.add(fileName);
        return String.join("/", segments);
    }

    static String sanitizeFileName(String name) {
        String result = RegexPatterns.PATH_SEPARATORS.matcher(name).replaceAll("_");
        return finish(RegexPatterns.INVALID_PATH_CHARS.matcher(result).replaceAll("_"), "file");
    }

    static String sanitizePathComponent(String name) {
        String result = RegexPatterns.PATH_SEPARATORS.matcher(name).replaceAll("");
        return finish(RegexPatterns.INVALID_PATH_CHARS.matcher(result).replaceAll("_"), "folder");
    }

    private static String finish(String value, String emptyReplacement) {
        String result = value.trim();
        result = RegexPatterns.TRAILING_DOTS.matcher(result).replaceAll("").trim();
        if (result.length() > MAX_COMPONENT_LENGTH) {
            result = result.substring(0, MAX_COMPONENT_LENGTH).trim();
        }
        return result.isEmpty() ? emptyReplacement : result;
    }

    private static String firstAuthor(BookMetadata metadata) {
        return metadata.getAuthors() == null
                ? UNKNOWN_AUTHOR
                : metadata.getAuthors().stream()
                .filter(e -> e != null && !e.isBlank())
                .map(String::trim)
                .findFirst()
                .orElse(UNKNOWN_AUTHOR);
    }
}
