package com.example.audiobook.adapters.storage;

import com.example.audiobook.adapters.DestinationEntry;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class FileSystemDestinationEntry implements DestinationEntry {
    @Getter
    private final Path path;

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public String getLocation() {
        return path.toAbsolutePath().toString();
    }

    @Override
    public boolean isDirectory() {
        return Files.isDirectory(path);
    }

    @Override
    public boolean canWrite() {
        return Files.isWritable(path);
    }

    @Override
    public Optional<DestinationEntry> findEntry(String name) {
        Path child = path.resolve(name);
        return Files.exists(child) ? Optional.of(new FileSystemDestinationEntry(child)) : Optional.empty();
    }

    @Override
    public Optional<DestinationEntry> createDirectory(String name) {
        try {
            return Optional.of(new FileSystemDestinationEntry(Files.createDirectory(path.resolve(name))));
        } catch (IOException e) {
            log.error("Failed to create directory {} in {}: {}", name, path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<DestinationEntry> createFile(String contentType, String name) {
        try {
            return Optional.of(new FileSystemDestinationEntry(Files.createFile(path.resolve(name))));
        } catch (IOException e) {
            log.error("Failed to create file {} ({}) in {}: {}", name, contentType, path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public OutputStream openOutputStream() throws IOException {
        return Files.newOutputStream(path);
    }

    @Override
    public boolean delete() {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }
}
