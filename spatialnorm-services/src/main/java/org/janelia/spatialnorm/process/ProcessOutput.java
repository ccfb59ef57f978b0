package org.janelia.spatialnorm.process;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

/**
 * Exit status and captured terminal output of a finished process.
 */
public class ProcessOutput {

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final String merged;

    public ProcessOutput(int exitCode, String stdout, String stderr, String merged) {
        this.exitCode = exitCode;
        this.stdout = StringUtils.defaultString(stdout);
        this.stderr = StringUtils.defaultString(stderr);
        this.merged = StringUtils.defaultString(merged);
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public String getMerged() {
        return merged;
    }

    /**
     * Write the non empty streams to {stdout,stderr,merged}.{suffix} in the given directory.
     *
     * @return the written files
     */
    public List<Path> saveStreams(Path dir, String suffix) {
        ImmutableList.Builder<Path> savedFiles = ImmutableList.builder();
        saveStream(dir.resolve("stdout." + suffix), stdout).ifPresent(savedFiles::add);
        saveStream(dir.resolve("stderr." + suffix), stderr).ifPresent(savedFiles::add);
        saveStream(dir.resolve("merged." + suffix), merged).ifPresent(savedFiles::add);
        return savedFiles.build();
    }

    private Optional<Path> saveStream(Path streamFile, String content) {
        if (StringUtils.isEmpty(content)) {
            return Optional.empty();
        }
        try {
            Files.createDirectories(streamFile.getParent());
            Files.write(streamFile, (content + "\n").getBytes(StandardCharsets.UTF_8));
            return Optional.of(streamFile);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
