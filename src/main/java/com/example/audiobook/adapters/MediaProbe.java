package com.example.audiobook.adapters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalDouble;

public interface MediaProbe {
    /**
     * Get the total duration of a media file.
     *
     * @return Returns the duration in seconds, or empty when it cannot be read.
     */
    OptionalDouble getDuration(Path file) throws IOException, InterruptedException;

    /**
     * Decode a window of the file and return the decoder log.
     *
     * @param file        The media file.
     * @param startSecond The offset of the window.
     * @param lengthSeconds The length of the window.
     * @return Returns the decoder log text, one message per line.
     */
    String decodeWindow(Path file, double startSecond, double lengthSeconds) throws IOException, InterruptedException;
}
