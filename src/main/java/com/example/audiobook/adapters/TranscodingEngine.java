package com.example.audiobook.adapters;

import com.example.audiobook.utils.model.TranscodeRequest;
import com.example.audiobook.utils.model.TranscodeResult;

import java.io.IOException;

public interface TranscodingEngine {
    /**
     * Run the decrypt-and-tag transcode described by the request.
     * An interrupt of the calling thread aborts the running transcode.
     *
     * @param request The request to execute.
     * @return Returns the outcome together with the engine log.
     * @throws IOException          Is thrown when the engine could not be started.
     * @throws InterruptedException Is thrown when the calling thread was interrupted.
     */
    TranscodeResult invoke(TranscodeRequest request) throws IOException, InterruptedException;
}
