package org.janelia.spatialnorm.process;

import java.nio.file.Path;

public interface ExternalProcessRunner {
    /**
     * Run the command in the given directory and block until it terminates.
     *
     * @return the process output; a process that could not be started is reported with a non zero exit code
     */
    ProcessOutput run(ExternalCommand command, Path workingDir);
}
