package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decrypt-and-tag request for the transcoding engine. The argument list is fully determined by
 * the request so that identical inputs always produce an identical invocation.
 */
@Value
@Builder
public class TranscodeRequest {
    @ToString.Exclude String key;
    @ToString.Exclude String iv;
    @NonNull Path input;
    Path coverArt;
    @NonNull Path output;
    @Singular
    Map<String, String> tags;

    public Optional<Path> getCoverArt() {
        return Optional.ofNullable(coverArt);
    }

    public List<String> toArguments() {
        List<String> args = new ArrayList<>(List.of("-y"));
        if (key != null && iv != null) {
            args.addAll(List.of("-audible_key", key, "-audible_iv", iv));
        }
        args.addAll(List.of("-i", input.toString()));

        if (coverArt != null) {
            args.addAll(List.of("-i", coverArt.toString()));
        }

        tags.forEach((name, value) -> args.addAll(List.of("-metadata", name + "=" + value)));

        // exactly one audio stream from the encrypted input
        args.addAll(List.of("-map", "0:a"));
        if (coverArt != null) {
            args.addAll(List.of("-map", "1", "-disposition:v:0", "attached_pic", "-c:v", "mjpeg"));
        } else {
            args.add("-vn");
        }

        args.addAll(List.of("-c:a", "copy", output.toString()));
        return args;
    }
}
