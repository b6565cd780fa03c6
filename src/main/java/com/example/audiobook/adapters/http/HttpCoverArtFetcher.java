package com.example.audiobook.adapters.http;

import com.example.audiobook.adapters.CoverArtFetcher;
import com.example.audiobook.exception.CoverArtException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Slf4j
public class HttpCoverArtFetcher implements CoverArtFetcher {
    private final Path stagingDirectory;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpCoverArtFetcher(Path stagingDirectory, Duration timeout) {
        this.stagingDirectory = stagingDirectory;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Path fetch(String url) throws CoverArtException, InterruptedException {
        Path coverFile = null;
        try {
            Files.createDirectories(stagingDirectory);
            coverFile = Files.createTempFile(stagingDirectory, "cover_", ".jpg");

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(coverFile));

            if (response.statusCode() != 200) {
                throw new CoverArtException("Cover art request failed with HTTP status " + response.statusCode());
            }

            log.debug("Downloaded cover art {} to {} ({} bytes)", url, coverFile, Files.size(coverFile));
            return coverFile;
        } catch (IOException | IllegalArgumentException e) {
            deleteQuietly(coverFile);
            throw new CoverArtException("Failed to download cover art from " + url, e);
        } catch (CoverArtException | InterruptedException e) {
            deleteQuietly(coverFile);
            throw e;
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete cover art staging file {}", file, e);
        }
    }
}
