package com.example.audiobook.service;

import com.example.audiobook.adapters.CoverArtFetcher;
import com.example.audiobook.adapters.MetadataStore;
import com.example.audiobook.adapters.TranscodingEngine;
import com.example.audiobook.exception.ConversionException;
import com.example.audiobook.exception.CoverArtException;
import com.example.audiobook.exception.TranscodeException;
import com.example.audiobook.exception.ValidationException;
import com.example.audiobook.utils.model.BookMetadata;
import com.example.audiobook.utils.model.ConversionContext;
import com.example.audiobook.utils.model.PipelineStage;
import com.example.audiobook.utils.model.ProgressEvent;
import com.example.audiobook.utils.model.TranscodeRequest;
import com.example.audiobook.utils.model.TranscodeResult;
import com.example.audiobook.utils.model.ValidationResult;
import com.example.audiobook.utils.model.WorkItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Turns a completed download into a decrypted, tagged and validated audiobook and hands it to
 * the {@link DestinationWriter}. Only one conversion runs at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionService {
    private static final int LOG_TAIL_LINES = 5;

    private final MetadataStore metadataStore;
    private final CoverArtFetcher coverArtFetcher;
    private final TranscodeRequestFactory transcodeRequestFactory;
    private final TranscodingEngine transcodingEngine;
    private final IntegrityValidator integrityValidator;
    private final DestinationWriter destinationWriter;
    private final PipelineEventPublisher eventPublisher;
    private final Semaphore conversionGate = new Semaphore(1, true);

    /**
     * Convert the downloaded item and place it in its destination.
     *
     * @param item The item of which the download completed.
     * @return Returns the final location of the audiobook.
     * @throws ConversionException  Is thrown when the transcode, the validation or the write failed.
     * @throws InterruptedException Is thrown when the conversion was cancelled.
     */
    public String convert(WorkItem item) throws ConversionException, InterruptedException {
        conversionGate.acquire();
        try {
            return doConvert(item);
        } finally {
            conversionGate.release();
        }
    }

    private String doConvert(WorkItem item) throws ConversionException, InterruptedException {
        String itemId = item.getItemId();
        log.info("Starting conversion for {}", itemId);
        eventPublisher.publishProgress(ProgressEvent.stageStarted(itemId, PipelineStage.DECRYPTING));

        ConversionContext context = new ConversionContext(item, fetchMetadata(itemId).orElse(null));
        Path coverArt = fetchCoverArt(context);

        try {
            transcode(context, coverArt);

            eventPublisher.publishProgress(ProgressEvent.stageStarted(itemId, PipelineStage.VALIDATING));
            ValidationResult validation = integrityValidator.validate(item.getDecryptedPath());
            if (!validation.isValid()) {
                log.error("Audio validation failed for {}: {} errors, duration {}s",
                        itemId, validation.getErrorCount(), validation.getDuration());
                deleteQuietly(item.getDecryptedPath());
                deleteQuietly(item.getEncryptedPath());
                throw new ValidationException("Audio file validation failed: " + validation.getErrorMessage(), validation);
            }
            log.info("Audio validation passed for {} ({}s, 0 errors)", itemId, validation.getDuration());

            eventPublisher.publishProgress(ProgressEvent.stageStarted(itemId, PipelineStage.COPYING));
            String finalPath = destinationWriter.write(context, item.getDecryptedPath(), coverArt);

            deleteQuietly(item.getEncryptedPath());
            return finalPath;
        } finally {
            deleteQuietly(coverArt);
        }
    }

    private void transcode(ConversionContext context, Path coverArt) throws TranscodeException, InterruptedException {
        WorkItem item = context.getItem();
        TranscodeRequest request = transcodeRequestFactory.create(context, coverArt);
        TranscodeResult result;
        try {
            result = transcodingEngine.invoke(request);
        } catch (IOException e) {
            deleteQuietly(item.getDecryptedPath());
            throw new TranscodeException("Transcoding could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            deleteQuietly(item.getDecryptedPath());
            throw e;
        }

        if (!result.isSuccess()) {
            // the encrypted input stays for a manual retry
            deleteQuietly(item.getDecryptedPath());
            throw new TranscodeException("Transcoding failed with exit code " + result.getReturnCode()
                    + ": " + tail(result.getLog()), result.getReturnCode());
        }
        log.info("Conversion complete for {}", item.getItemId());
    }

    private Optional<BookMetadata> fetchMetadata(String itemId) {
        try {
            Optional<BookMetadata> metadata = metadataStore.getMetadataByExternalId(itemId);
            if (metadata.isEmpty()) {
                log.warn("No metadata found for {}, converting without tags", itemId);
            }
            return metadata;
        } catch (RuntimeException e) {
            log.warn("Error fetching metadata for {}: {}", itemId, e.getMessage());
            return Optional.empty();
        }
    }

    private Path fetchCoverArt(ConversionContext context) throws InterruptedException {
        String coverUrl = context.getMetadata()
                .map(BookMetadata::getCoverUrl)
                .filter(e -> !e.isBlank())
                .orElse(null);
        if (coverUrl == null) {
            return null;
        }

        try {
            Path coverArt = coverArtFetcher.fetch(coverUrl);
            log.debug("Downloaded cover art for {}: {}", context.getItemId(), coverArt);
            return coverArt;
        } catch (CoverArtException e) {
            log.warn("Failed to download cover art for {}: {}", context.getItemId(), e.getMessage());
            return null;
        }
    }

    private static String tail(String text) {
        if (text == null || text.isBlank()) {
            return "no output";
        }
        String[] lines = text.strip().split("\n");
        int from = Math.max(0, lines.length - LOG_TAIL_LINES);
        return String.join("\n", Arrays.copyOfRange(lines, from, lines.length));
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete staging file {}: {}", file, e.getMessage());
        }
    }
}
