package com.example.audiobook.adapters.ffmpeg;

import com.example.audiobook.adapters.TranscodingEngine;
import com.example.audiobook.utils.model.TranscodeRequest;
import com.example.audiobook.utils.model.TranscodeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Transcoding engine backed by an ffmpeg executable. Tag values are passed as separate
 * process arguments, so they never need shell quoting.
 */
@Slf4j
@RequiredArgsConstructor
public class FfmpegTranscodingEngine implements TranscodingEngine {
    private final String ffmpegPath;

    @Override
    public TranscodeResult invoke(TranscodeRequest request) throws IOException, InterruptedException {
        List<String> command = buildCommand(request);
        log.info("Transcoding {} -> {}", request.getInput(), request.getOutput());

        ProcessExecutor.Output output = ProcessExecutor.execute(command, "FFmpeg transcode");
        if (output.getExitCode() == 0) {
            log.info("FFmpeg transcode completed successfully");
            return TranscodeResult.success(output.getText());
        }

        log.error("FFmpeg transcode failed with exit code {}", output.getExitCode());
        return TranscodeResult.failure(output.getExitCode(), output.getText());
    }

    List<String> buildCommand(TranscodeRequest request) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.addAll(request.toArguments());
        return command;
    }
}
