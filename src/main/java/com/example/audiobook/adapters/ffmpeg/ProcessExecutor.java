package com.example.audiobook.adapters.ffmpeg;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool and collects its combined output.
 */
@Slf4j
class ProcessExecutor {
    private ProcessExecutor() {
    }

    static Output execute(List<String> command, String operation) throws IOException, InterruptedException {
        log.debug("{} command: {}", operation, String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        StringBuffer output = new StringBuffer();
        Thread outputReader = getOutputReader(process, output, operation);

        try {
            int exitCode = process.waitFor();
            outputReader.join();
            log.debug("{} finished with exit code {}", operation, exitCode);
            return new Output(exitCode, output.toString());
        } catch (InterruptedException e) {
            log.debug("{} interrupted, stopping process", operation);
            process.destroyForcibly();
            process.waitFor(3, TimeUnit.SECONDS);
            throw e;
        }
    }

    private static Thread getOutputReader(Process process, StringBuffer output, String operation) {
        Thread outputReader = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    log.trace("{}: {}", operation, line);
                }
            } catch (IOException e) {
                log.error("Error reading {} output: {}", operation, e.getMessage());
            }
        }, operation + "-output");
        outputReader.setDaemon(true);
        outputReader.start();
        return outputReader;
    }

    @Value
    static class Output {
        int exitCode;
        String text;
    }
}
