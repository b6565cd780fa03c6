package com.example.audiobook.service;

import com.example.audiobook.adapters.DestinationEntry;
import com.example.audiobook.adapters.DestinationStorage;
import com.example.audiobook.adapters.PreferenceStore;
import com.example.audiobook.exception.CoverArtException;
import com.example.audiobook.exception.DestinationPermissionException;
import com.example.audiobook.exception.DestinationWriteException;
import com.example.audiobook.utils.model.CompletionEvent;
import com.example.audiobook.utils.model.ConversionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Places validated audiobooks in the user's destination.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DestinationWriter {
    static final List<String> AUDIO_CONTENT_TYPES = List.of("audio/mp4", "audio/x-m4b", "audio/*");
    static final String COMPANION_COVER_NAME = "EmbeddedCover.jpg";
    static final String COMPANION_COVER_TYPE = "image/jpeg";
    static final int COMPANION_COVER_SIZE = 500;
    private static final int BUFFER_SIZE = 64 * 1024;

    private final DestinationStorage destinationStorage;
    private final PreferenceStore preferenceStore;
    private final FileNamingService fileNamingService;
    private final CoverImageRenderer coverImageRenderer;
    private final ManualPauseLedger manualPauseLedger;
    private final PipelineEventPublisher eventPublisher;

    /**
     * Write the validated artifact into the destination of the context.
     *
     * @param context       The conversion context of the item.
     * @param validatedPath The local, validated artifact. Deleted once the copy succeeded.
     * @param coverArtPath  The optional cover art staging file, can be {@code null}.
     * @return Returns the final location of the artifact.
     * @throws DestinationWriteException Is thrown when the artifact could not be placed, the staging copy is kept.
     * @throws InterruptedException      Is thrown when the copy was cancelled.
     */
    public String write(ConversionContext context, Path validatedPath, Path coverArtPath)
            throws DestinationWriteException, InterruptedException {
        String itemId = context.getItemId();
        String relativePath = fileNamingService.resolveOrFallback(context, preferenceStore.getNamingPattern());
        log.debug("Using file path {} for {}", relativePath, itemId);

        DestinationEntry root;
        try {
            root = destinationStorage.resolveRoot(context.getItem().getDestinationDirectory());
        } catch (IOException e) {
            throw new DestinationWriteException("Invalid destination " + context.getItem().getDestinationDirectory()
                    + ": " + e.getMessage(), e);
        }
        if (!root.canWrite()) {
            throw new DestinationPermissionException("No write permission for destination " + root.getLocation());
        }

        List<String> segments = Arrays.asList(relativePath.split("/"));
        String fileName = segments.get(segments.size() - 1);
        DestinationEntry directory = createDirectories(root, segments.subList(0, segments.size() - 1));

        directory.findEntry(fileName).ifPresent(e -> {
            log.debug("Replacing existing file {}", e.getLocation());
            e.delete();
        });
        DestinationEntry target = createFile(directory, AUDIO_CONTENT_TYPES, fileName)
                .orElseThrow(() -> new DestinationWriteException("Failed to create " + fileName + " in " + directory.getLocation()));

        log.info("Copying {} to {}", validatedPath, target.getLocation());
        copy(validatedPath, target);
        deleteStagingCopy(validatedPath);

        if (coverArtPath != null && preferenceStore.isCompanionCoverEnabled()) {
            writeCompanionCover(directory, coverArtPath);
        }

        try {
            manualPauseLedger.clear(itemId);
        } catch (RuntimeException e) {
            log.warn("Failed to clear manual pause marker of {}: {}", itemId, e.getMessage());
        }
        eventPublisher.publishCompletion(new CompletionEvent(itemId, context.getTitle(), target.getLocation()));
        return target.getLocation();
    }

    private DestinationEntry createDirectories(DestinationEntry root, List<String> directories) throws DestinationWriteException {
        DestinationEntry current = root;
        for (String name : directories) {
            Optional<DestinationEntry> existing = current.findEntry(name);
            if (existing.isPresent() && existing.get().isDirectory()) {
                current = existing.get();
            } else {
                DestinationEntry parent = current;
                current = current.createDirectory(name)
                        .orElseThrow(() -> new DestinationWriteException("Failed to create directory " + name
                                + " in " + parent.getLocation()));
            }
        }
        return current;
    }

    private static Optional<DestinationEntry> createFile(DestinationEntry directory, List<String> contentTypes, String name) {
        for (String contentType : contentTypes) {
            Optional<DestinationEntry> file = directory.createFile(contentType, name);
            if (file.isPresent()) {
                return file;
            }
            log.debug("Destination refused {} as {}", name, contentType);
        }
        return Optional.empty();
    }

    private static void copy(Path source, DestinationEntry target) throws DestinationWriteException, InterruptedException {
        try (InputStream input = Files.newInputStream(source);
             OutputStream output = target.openOutputStream()) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = input.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Copy to " + target.getLocation() + " cancelled");
                }
                output.write(buffer, 0, read);
            }
        } catch (IOException e) {
            target.delete();
            throw new DestinationWriteException("Failed to copy to " + target.getLocation() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            target.delete();
            throw e;
        }
    }

    private void writeCompanionCover(DestinationEntry directory, Path coverArtPath) {
        try {
            directory.findEntry(COMPANION_COVER_NAME).ifPresent(DestinationEntry::delete);
            DestinationEntry cover = directory.createFile(COMPANION_COVER_TYPE, COMPANION_COVER_NAME)
                    .orElseThrow(() -> new CoverArtException("Failed to create " + COMPANION_COVER_NAME));
            try (OutputStream output = cover.openOutputStream()) {
                coverImageRenderer.renderSquareJpeg(coverArtPath, COMPANION_COVER_SIZE, output);
            } catch (CoverArtException | IOException e) {
                cover.delete();
                throw e;
            }
            log.debug("Saved {} ({}x{}) to {}", COMPANION_COVER_NAME, COMPANION_COVER_SIZE, COMPANION_COVER_SIZE, cover.getLocation());
        } catch (CoverArtException | IOException | RuntimeException e) {
            log.warn("Failed to save companion cover in {}: {}", directory.getLocation(), e.getMessage());
        }
    }

    private static void deleteStagingCopy(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete staging copy {}: {}", file, e.getMessage());
        }
    }
}
