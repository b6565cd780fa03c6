package com.example.audiobook.adapters;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Optional;

/**
 * A file or directory within a {@link DestinationStorage}.
 */
public interface DestinationEntry {
    String getName();

    /**
     * @return Returns the location of this entry as it should be reported to the user.
     */
    String getLocation();

    boolean isDirectory();

    boolean canWrite();

    Optional<DestinationEntry> findEntry(String name);

    Optional<DestinationEntry> createDirectory(String name);

    /**
     * Create a new, empty file in this directory.
     *
     * @param contentType The content type to register the file with.
     * @param name        The name of the file.
     * @return Returns the created file, or empty when the store refused the content type or name.
     */
    Optional<DestinationEntry> createFile(String contentType, String name);

    OutputStream openOutputStream() throws IOException;

    boolean delete();
}
