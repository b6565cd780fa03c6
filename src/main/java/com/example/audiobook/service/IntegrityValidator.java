package com.example.audiobook.service;

import com.example.audiobook.adapters.MediaProbe;
import com.example.audiobook.config.ApplicationConfig;
import com.example.audiobook.utils.constants.RegexPatterns;
import com.example.audiobook.utils.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * Detects localized corruption of a decoded audiobook by decoding short windows at a handful of
 * positions instead of the whole file.
 */
@Slf4j
@Service
public class IntegrityValidator {
    static final double EDGE_OFFSET_SECONDS = 30.0;
    static final double MIN_END_SAMPLE_SECONDS = 60.0;
    static final int EARLY_STOP_THRESHOLD = 50;

    private final MediaProbe mediaProbe;
    private final double windowSeconds;

    public IntegrityValidator(MediaProbe mediaProbe, ApplicationConfig config) {
        this.mediaProbe = mediaProbe;
        this.windowSeconds = config.getSampleWindow().toMillis() / 1000.0;
    }

    public ValidationResult validate(Path file) throws InterruptedException {
        log.debug("Validating audio file: {}", file);
        double duration;
        try {
            OptionalDouble probed = mediaProbe.getDuration(file);
            duration = probed.orElse(0.0);
        } catch (IOException e) {
            log.error("Could not probe {}: {}", file, e.getMessage());
            return ValidationResult.notAssessed("Validation failed: " + e.getMessage());
        }

        if (duration <= 0) {
            log.error("Invalid duration {} for {}", duration, file);
            return ValidationResult.notAssessed("Could not determine file duration");
        }

        List<Double> samplePoints = samplePoints(duration);
        log.debug("File duration {}s, sampling {} points", duration, samplePoints.size());

        List<String> report = new ArrayList<>();
        int totalErrors = 0;
        for (int i = 0; i < samplePoints.size(); i++) {
            double timestamp = samplePoints.get(i);
            String decodeLog;
            try {
                decodeLog = mediaProbe.decodeWindow(file, timestamp, windowSeconds);
            } catch (IOException e) {
                log.error("Could not decode {} at {}s: {}", file, timestamp, e.getMessage());
                return ValidationResult.notAssessed("Validation failed: " + e.getMessage());
            }

            int errors = countErrors(decodeLog);
            totalErrors += errors;
            String timestampText = formatTimestamp((long) timestamp);
            report.add(errors == 0
                    ? "  [" + timestampText + "] OK"
                    : "  [" + timestampText + "] FAILED (" + errors + " errors)");
            log.debug("Sample {}/{} at {}: {} errors", i + 1, samplePoints.size(), timestampText, errors);

            if (errors > EARLY_STOP_THRESHOLD) {
                log.warn("High error count detected at {}, stopping validation", timestampText);
                break;
            }
        }

        boolean valid = totalErrors == 0;
        return ValidationResult.builder()
                .valid(valid)
                .errorCount(totalErrors)
                .errorMessage(valid
                        ? "Audio file validated successfully"
                        : "Audio corruption detected: " + totalErrors + " total errors\n" + String.join("\n", report))
                .duration(duration)
                .sampleReport(report)
                .build();
    }

    /**
     * Sample positions, in seconds: 30s in, at 25%, 50% and 75%, and 30s before the end (never
     * before 60s). Duplicates are dropped and the points are sorted ascending.
     */
    static List<Double> samplePoints(double duration) {
        TreeSet<Double> points = new TreeSet<>();
        points.add(EDGE_OFFSET_SECONDS);
        points.add(duration * 0.25);
        points.add(duration * 0.50);
        points.add(duration * 0.75);
        points.add(Math.max(duration - EDGE_OFFSET_SECONDS, MIN_END_SAMPLE_SECONDS));
        return new ArrayList<>(points);
    }

    static int countErrors(String decodeLog) {
        if (decodeLog == null || decodeLog.isEmpty()) {
            return 0;
        }
        return (int) decodeLog.lines()
                .filter(e -> RegexPatterns.DECODE_ERROR_PATTERN.matcher(e).find())
                .count();
    }

    static String formatTimestamp(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, secs);
    }
}
