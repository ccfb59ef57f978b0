package org.janelia.spatialnorm.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.spatialnorm.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;

public class LocalProcessRunnerTest {

    private LocalProcessRunner processRunner;
    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        processRunner = new LocalProcessRunner(mock(Logger.class));
        testDirectory = Files.createTempDirectory("testProcessRunner");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    @Test
    public void captureOutputsAndExitCode() {
        ExternalCommand cmd = ExternalCommand.builder("sh")
                .addArgs("-c", "echo $SPATIALNORM_TEST_VAR; echo failed >&2; touch created.txt; exit 3")
                .setEnv("SPATIALNORM_TEST_VAR", "from env")
                .build();

        ProcessOutput processOutput = processRunner.run(cmd, testDirectory.resolve("work"));

        assertThat(processOutput.getExitCode(), equalTo(3));
        assertThat(processOutput.getStdout(), equalTo("from env"));
        assertThat(processOutput.getStderr(), equalTo("failed"));
        assertThat(processOutput.getMerged(), containsString("from env"));
        assertThat(processOutput.getMerged(), containsString("failed"));
        assertTrue(Files.exists(testDirectory.resolve("work").resolve("created.txt")));
    }

    @Test
    public void missingExecutable() {
        ExternalCommand cmd = ExternalCommand.builder(testDirectory.resolve("antsRegistration").toString()).build();

        ProcessOutput processOutput = processRunner.run(cmd, testDirectory);

        assertThat(processOutput.getExitCode(), equalTo(LocalProcessRunner.CANNOT_EXECUTE_EXIT_CODE));
        assertThat(processOutput.getStderr(), containsString("Cannot execute"));
    }
}
