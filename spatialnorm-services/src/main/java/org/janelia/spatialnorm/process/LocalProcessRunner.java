package org.janelia.spatialnorm.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.inject.Inject;

import org.apache.commons.collections4.MapUtils;
import org.janelia.spatialnorm.common.ComputationException;
import org.slf4j.Logger;

/**
 * Runs the command as a child process of the current JVM. Stdout and stderr are drained by separate threads
 * so that neither pipe can fill up and block the child.
 */
public class LocalProcessRunner implements ExternalProcessRunner {

    static final int CANNOT_EXECUTE_EXIT_CODE = 127;

    private final Logger logger;

    @Inject
    public LocalProcessRunner(Logger logger) {
        this.logger = logger;
    }

    @Override
    public ProcessOutput run(ExternalCommand command, Path workingDir) {
        ProcessBuilder processBuilder = new ProcessBuilder(command.getArgs());
        if (MapUtils.isNotEmpty(command.getEnv())) {
            processBuilder.environment().putAll(command.getEnv());
        }
        try {
            Files.createDirectories(workingDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        processBuilder.directory(workingDir.toFile());
        logger.info("Start {} in {} using env {}", command.getExecutable(), workingDir, command.getEnv());
        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            logger.error("Error starting {}", command.getExecutable(), e);
            String errorMessage = "Cannot execute " + command.getExecutable() + ": " + e.getMessage();
            return new ProcessOutput(CANNOT_EXECUTE_EXIT_CODE, "", errorMessage, errorMessage);
        }
        StringBuilder merged = new StringBuilder();
        StreamCollector stdoutCollector = new StreamCollector(process.getInputStream(), merged);
        StreamCollector stderrCollector = new StreamCollector(process.getErrorStream(), merged);
        Thread stdoutThread = new Thread(stdoutCollector, command.getExecutable() + "-stdout");
        Thread stderrThread = new Thread(stderrCollector, command.getExecutable() + "-stderr");
        stdoutThread.start();
        stderrThread.start();
        try {
            int exitCode = process.waitFor();
            stdoutThread.join();
            stderrThread.join();
            logger.info("{} terminated with exit code {}", command.getExecutable(), exitCode);
            String mergedOutput;
            synchronized (merged) {
                mergedOutput = merged.toString();
            }
            return new ProcessOutput(exitCode, stdoutCollector.getContent(), stderrCollector.getContent(), mergedOutput);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ComputationException("Interrupted while waiting for " + command.getExecutable(), e);
        }
    }

    private class StreamCollector implements Runnable {
        private final InputStream stream;
        private final StringBuilder merged;
        private final StringBuilder content = new StringBuilder();

        StreamCollector(InputStream stream, StringBuilder merged) {
            this.stream = stream;
            this.merged = merged;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    append(content, line);
                    synchronized (merged) {
                        append(merged, line);
                    }
                }
            } catch (IOException e) {
                logger.warn("Error reading process output", e);
            }
        }

        private void append(StringBuilder sb, String line) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line);
        }

        synchronized String getContent() {
            return content.toString();
        }
    }
}
