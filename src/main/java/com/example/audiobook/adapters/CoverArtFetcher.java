package com.example.audiobook.adapters;

import com.example.audiobook.exception.CoverArtException;

import java.nio.file.Path;

public interface CoverArtFetcher {
    /**
     * Download the cover art into a transient staging file.
     *
     * @param url The cover art url.
     * @return Returns the staging file, owned by the caller.
     */
    Path fetch(String url) throws CoverArtException, InterruptedException;
}
