package org.janelia.spatialnorm.normalization;

import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.janelia.spatialnorm.normalization.ants.RegistrationOutputs;

/**
 * Outcome of running the registration with one preset: either the produced outputs
 * or the diagnostics saved for the failed run.
 */
public abstract class RegistrationAttemptResult {

    private final int attempt;

    private RegistrationAttemptResult(int attempt) {
        this.attempt = attempt;
    }

    public static Success success(int attempt, RegistrationOutputs outputs) {
        return new Success(attempt, outputs);
    }

    public static Failure failure(int attempt, int exitCode, List<Path> diagnostics) {
        return new Failure(attempt, exitCode, diagnostics);
    }

    public int getAttempt() {
        return attempt;
    }

    public abstract boolean isSuccess();

    public static final class Success extends RegistrationAttemptResult {
        private final RegistrationOutputs outputs;

        private Success(int attempt, RegistrationOutputs outputs) {
            super(attempt);
            this.outputs = outputs;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        public RegistrationOutputs getOutputs() {
            return outputs;
        }
    }

    public static final class Failure extends RegistrationAttemptResult {
        private final int exitCode;
        private final List<Path> diagnostics;

        private Failure(int attempt, int exitCode, List<Path> diagnostics) {
            super(attempt);
            this.exitCode = exitCode;
            this.diagnostics = ImmutableList.copyOf(diagnostics);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public int getExitCode() {
            return exitCode;
        }

        public List<Path> getDiagnostics() {
            return diagnostics;
        }
    }
}
