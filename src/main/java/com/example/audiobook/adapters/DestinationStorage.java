package com.example.audiobook.adapters;

import java.io.IOException;

/**
 * Storage holding the user's final library. Locations are addressed hierarchically through
 * {@link DestinationEntry} so that sandboxed stores can be supported next to plain directories.
 */
public interface DestinationStorage {
    /**
     * Resolve the root entry of a destination location.
     *
     * @param location The destination as configured by the user.
     * @return Returns the root directory entry.
     * @throws IOException Is thrown when the location is not a usable directory.
     */
    DestinationEntry resolveRoot(String location) throws IOException;
}
