package com.example.audiobook.utils.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Input of a single conversion attempt, built fresh from a completed work item.
 */
@Value
public class ConversionContext {
    @NonNull WorkItem item;
    BookMetadata metadata;

    public Optional<BookMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    public String getItemId() {
        return item.getItemId();
    }

    public String getTitle() {
        return item.getTitle();
    }
}
