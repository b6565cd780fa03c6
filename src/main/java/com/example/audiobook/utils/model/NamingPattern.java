package com.example.audiobook.utils.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Layout of the final artifact below the destination root.
 */
@Getter
@RequiredArgsConstructor
public enum NamingPattern {
    /** {@code Title.m4b} */
    FLAT_FILE("flat_file"),
    /** {@code Author/Title/Title.m4b} */
    AUTHOR_BOOK_FOLDER("author_book_folder"),
    /** {@code Author/Series/Title/Title.m4b} */
    AUTHOR_SERIES_BOOK("author_series_book");

    private final String key;

    public static NamingPattern fromKey(String key) {
        return Arrays.stream(values())
                .filter(e -> e.key.equalsIgnoreCase(key))
                .findFirst()
                .orElse(AUTHOR_SERIES_BOOK);
    }
}
