package com.example.audiobook.service;

import com.example.audiobook.exception.TranscodeException;
import com.example.audiobook.utils.model.BookMetadata;
import com.example.audiobook.utils.model.ConversionContext;
import com.example.audiobook.utils.model.TranscodeRequest;
import com.example.audiobook.utils.model.WorkItem;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps library metadata onto the tag set of the decrypted audiobook.
 */
@Component
public class TranscodeRequestFactory {
    static final String GENRE = "Audiobook";
    static final String NAME_SEPARATOR = ", ";

    /**
     * Create the transcode request of the context.
     *
     * @throws TranscodeException Is thrown when the item carries no decryption key or iv.
     */
    public TranscodeRequest create(ConversionContext context, Path coverArt) throws TranscodeException {
        WorkItem item = context.getItem();
        if (!hasText(item.getKey()) || !hasText(item.getIv())) {
            throw new TranscodeException("Missing decryption key material for " + item.getItemId(), -1);
        }
        return TranscodeRequest.builder()
                .key(item.getKey())
                .iv(item.getIv())
                .input(item.getEncryptedPath())
                .coverArt(coverArt)
                .output(item.getDecryptedPath())
                .tags(buildTags(context))
                .build();
    }

    /**
     * Build the tag set of the context. Without metadata the tag set is empty.
     */
    Map<String, String> buildTags(ConversionContext context) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (context.getMetadata().isEmpty()) {
            return tags;
        }

        BookMetadata metadata = context.getMetadata().get();
        putIfPresent(tags, "title", metadata.getTitle());
        putIfPresent(tags, "comment", buildComment(metadata));

        String authors = joinNames(metadata.getAuthors());
        putIfPresent(tags, "artist", authors);
        putIfPresent(tags, "album_artist", authors);
        putIfPresent(tags, "composer", joinNames(metadata.getNarrators()));

        String year = extractYear(metadata.getReleaseDate());
        if (hasText(metadata.getPublisher())) {
            String publisher = metadata.getPublisher();
            String copyrightYear = year != null ? year : String.valueOf(Year.now().getValue());
            tags.put("publisher", publisher);
            tags.put("copyright", "©" + copyrightYear + " " + publisher + ";(P)" + copyrightYear + " " + publisher);
        }

        putIfPresent(tags, "album", buildAlbum(metadata));
        putIfPresent(tags, "date", year);
        putIfPresent(tags, "language", metadata.getLanguage());
        putIfPresent(tags, "grouping", hasText(metadata.getExternalId()) ? metadata.getExternalId() : context.getItemId());
        tags.put("genre", GENRE);
        return tags;
    }

    private static String buildComment(BookMetadata metadata) {
        String description = metadata.getDescription();
        String subtitle = metadata.getSubtitle();
        if (hasText(subtitle)) {
            return hasText(description)
                    ? description + "\n\nSubtitle: " + subtitle
                    : "Subtitle: " + subtitle;
        }
        return description;
    }

    private static String buildAlbum(BookMetadata metadata) {
        if (!hasText(metadata.getSeriesName())) {
            return null;
        }
        return hasText(metadata.getSeriesSequence())
                ? metadata.getSeriesName() + ", Book " + metadata.getSeriesSequence()
                : metadata.getSeriesName();
    }

    static String extractYear(String date) {
        if (date == null || date.length() < 4) {
            return null;
        }
        return date.substring(0, 4);
    }

    private static String joinNames(List<String> names) {
        if (names == null) {
            return null;
        }
        String joined = String.join(NAME_SEPARATOR, names.stream()
                .filter(TranscodeRequestFactory::hasText)
                .map(String::trim)
                .toList());
        return joined.isEmpty() ? null : joined;
    }

    private static void putIfPresent(Map<String, String> tags, String name, String value) {
        if (hasText(value)) {
            tags.put(name, value);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
