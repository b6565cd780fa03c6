package com.example.audiobook.adapters.storage;

import com.example.audiobook.adapters.DestinationEntry;
import com.example.audiobook.adapters.DestinationStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Destination storage for plain directories of the local file system.
 */
@Slf4j
public class FileSystemDestinationStorage implements DestinationStorage {
    @Override
    public DestinationEntry resolveRoot(String location) throws IOException {
        Path root = Paths.get(location);
        if (!Files.exists(root)) {
            Files.createDirectories(root);
            log.info("Created destination directory: {}", root);
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Destination is not a directory: " + root);
        }
        return new FileSystemDestinationEntry(root);
    }
}
