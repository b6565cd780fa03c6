package com.example.audiobook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class ApplicationConfig {
    private String stagingDirectory = Paths.get(System.getProperty("java.io.tmpdir"), "audiobooks").toString();
    private String preferencesFile = "audiobook-pipeline.cfg";
    private String libraryFile = "library.json";
    private String ffmpegPath = "ffmpeg";
    private String ffprobePath = "ffprobe";
    private String defaultQuality = "High";

    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration sampleWindow = Duration.ofSeconds(10);
    private Duration connectivityCheckInterval = Duration.ofSeconds(5);
    private Duration coverArtTimeout = Duration.ofSeconds(30);
    private String qualifyingInterfacePattern = "^(wlan|wlp|wl|en)\\w*";

    private int monitorPoolSize = 4;
    private String threadNamePrefix = "Pipeline-";

    public Path getStagingPath() {
        return Paths.get(stagingDirectory);
    }
}
