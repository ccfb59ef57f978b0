package org.janelia.spatialnorm.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.janelia.spatialnorm.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ProcessOutputTest {

    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("testProcessOutput");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    @Test
    public void emptyStreamsAreNotSaved() throws IOException {
        ProcessOutput processOutput = new ProcessOutput(1, null, "Segmentation fault", "Segmentation fault");

        List<Path> savedFiles = processOutput.saveStreams(testDirectory, "nipype-0002");

        assertThat(savedFiles, contains(testDirectory.resolve("stderr.nipype-0002"), testDirectory.resolve("merged.nipype-0002")));
        assertFalse(Files.exists(testDirectory.resolve("stdout.nipype-0002")));
        assertThat(new String(Files.readAllBytes(testDirectory.resolve("stderr.nipype-0002")), StandardCharsets.UTF_8),
                equalTo("Segmentation fault\n"));
        assertFalse(processOutput.succeeded());
    }

    @Test
    public void silentProcess() {
        ProcessOutput processOutput = new ProcessOutput(0, "", "", "");

        assertThat(processOutput.saveStreams(testDirectory.resolve("logs"), "nipype-init"), empty());
        assertTrue(processOutput.succeeded());
    }
}
