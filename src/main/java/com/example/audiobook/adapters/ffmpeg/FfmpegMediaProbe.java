package com.example.audiobook.adapters.ffmpeg;

import com.example.audiobook.adapters.MediaProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

@Slf4j
@RequiredArgsConstructor
public class FfmpegMediaProbe implements MediaProbe {
    private final String ffmpegPath;
    private final String ffprobePath;

    @Override
    public OptionalDouble getDuration(Path file) throws IOException, InterruptedException {
        List<String> command = List.of(ffprobePath,
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                file.toString());

        ProcessExecutor.Output output = ProcessExecutor.execute(command, "FFprobe duration");
        if (output.getExitCode() != 0) {
            log.warn("FFprobe could not read {}: {}", file, output.getText().trim());
            return OptionalDouble.empty();
        }

        return parseDuration(output.getText());
    }

    @Override
    public String decodeWindow(Path file, double startSecond, double lengthSeconds) throws IOException, InterruptedException {
        List<String> command = List.of(ffmpegPath,
                "-v", "error",
                "-ss", formatSeconds(startSecond),
                "-i", file.toString(),
                "-t", formatSeconds(lengthSeconds),
                "-f", "null", "-");

        return ProcessExecutor.execute(command, "FFmpeg decode").getText();
    }

    static OptionalDouble parseDuration(String text) {
        for (String line : text.split("\n")) {
            String value = line.trim();
            if (value.isEmpty() || "N/A".equals(value)) {
                continue;
            }
            try {
                return OptionalDouble.of(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                log.debug("Ignoring unexpected ffprobe output line: {}", value);
            }
        }
        return OptionalDouble.empty();
    }

    private static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
