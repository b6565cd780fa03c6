package com.example.audiobook.adapters;

import com.example.audiobook.utils.model.BookMetadata;

import java.util.Optional;

public interface MetadataStore {
    /**
     * Look up the library metadata of an item.
     *
     * @param externalId The external item id.
     * @return Returns the metadata if the library knows the item, else empty.
     */
    Optional<BookMetadata> getMetadataByExternalId(String externalId);
}
