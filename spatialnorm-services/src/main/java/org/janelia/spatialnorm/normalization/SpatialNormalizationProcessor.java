package org.janelia.spatialnorm.normalization;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import jakarta.inject.Inject;

import org.janelia.spatialnorm.common.ComputationException;
import org.janelia.spatialnorm.exceptions.MissingDataException;
import org.janelia.spatialnorm.exceptions.PresetsExhaustedException;
import org.janelia.spatialnorm.normalization.ants.AntsCommandFactory;
import org.janelia.spatialnorm.normalization.ants.RegistrationPreset;
import org.janelia.spatialnorm.normalization.ants.RegistrationPresetLoader;
import org.janelia.spatialnorm.process.ExternalCommand;
import org.janelia.spatialnorm.process.ExternalProcessRunner;
import org.janelia.spatialnorm.process.ProcessOutput;
import org.slf4j.Logger;

/**
 * Robust spatial normalization: registers the moving image to the reference trying the presets one after
 * the other until one of them succeeds.
 *
 * The working directory holds the intermediate masks, the last command line (command.txt) and the terminal
 * outputs of the initialization and of every failed attempt, so it must not be shared by concurrent jobs.
 */
public class SpatialNormalizationProcessor {

    static final String COMMAND_FILE = "command.txt";
    static final String INIT_LOG_SUFFIX = "nipype-init";
    static final String ATTEMPT_LOG_SUFFIX_FORMAT = "nipype-%04d";

    private final RegistrationInputsResolver inputsResolver;
    private final PresetLookup presetLookup;
    private final RegistrationPresetLoader presetLoader;
    private final AntsCommandFactory antsCommandFactory;
    private final ExternalProcessRunner processRunner;
    private final Logger logger;

    @Inject
    public SpatialNormalizationProcessor(RegistrationInputsResolver inputsResolver,
                                         PresetLookup presetLookup,
                                         RegistrationPresetLoader presetLoader,
                                         AntsCommandFactory antsCommandFactory,
                                         ExternalProcessRunner processRunner,
                                         Logger logger) {
        this.inputsResolver = inputsResolver;
        this.presetLookup = presetLookup;
        this.presetLoader = presetLoader;
        this.antsCommandFactory = antsCommandFactory;
        this.processRunner = processRunner;
        this.logger = logger;
    }

    public SpatialNormalizationResult process(RegistrationJob job, Path workingDir) {
        logger.info("Start spatial normalization of {} in {}", job.getMovingImage(), workingDir);
        createWorkingDir(workingDir);
        RegistrationInputs inputs = inputsResolver.resolveInputs(job, workingDir);
        List<Path> presets = presetLookup.getSettings(job);
        if (presets.isEmpty()) {
            throw new MissingDataException("No registration presets found for " + job.getMoving() + " " + job.getFlavor());
        }
        if (inputs.getInitialMovingTransform() == null) {
            inputs = inputs.withInitialMovingTransform(estimateInitialTransform(inputs, workingDir));
        }
        RetryState retryState = new RetryState(inputs.getReferenceImage());
        for (Path presetFile : presets) {
            RegistrationAttemptResult attemptResult = runAttempt(retryState.getAttempt(), presetFile, job, inputs, workingDir);
            if (attemptResult.isSuccess()) {
                RegistrationAttemptResult.Success success = (RegistrationAttemptResult.Success) attemptResult;
                retryState.recordSuccess(success);
                logger.info("Successful spatial normalization (retry #{}).", success.getAttempt());
                return new SpatialNormalizationResult(
                        success.getOutputs(),
                        retryState.getReferenceImage(),
                        success.getAttempt(),
                        toStrings(retryState.getFailureLogs()));
            } else {
                RegistrationAttemptResult.Failure failure = (RegistrationAttemptResult.Failure) attemptResult;
                logger.warn("Retry #{} failed with exit code {}.", failure.getAttempt(), failure.getExitCode());
                retryState.recordFailure(failure);
            }
        }
        throw new PresetsExhaustedException(retryState.getFailedAttempts(), toStrings(retryState.getFailureLogs()));
    }

    private String estimateInitialTransform(RegistrationInputs inputs, Path workingDir) {
        logger.info("Estimating initial transform using AffineInitializer");
        ExternalCommand initializerCmd = antsCommandFactory.createAffineInitializerCommand(
                inputs.getFixedImage(), inputs.getMovingImage(), inputs.getNumThreads());
        ProcessOutput initializerOutput = processRunner.run(initializerCmd, workingDir);
        List<Path> initializerLogs = initializerOutput.saveStreams(workingDir, INIT_LOG_SUFFIX);
        logger.info("Terminal outputs of initialization saved ({}).", initializerLogs);
        Path initialTransform = workingDir.resolve(AntsCommandFactory.INITIAL_TRANSFORM_FILE);
        if (!initializerOutput.succeeded()) {
            throw new ComputationException("Initial transform estimation failed with exit code " + initializerOutput.getExitCode()
                    + ": " + initializerOutput.getStderr());
        } else if (Files.notExists(initialTransform)) {
            throw new ComputationException("Initial transform estimation did not produce " + initialTransform);
        }
        return initialTransform.toAbsolutePath().toString();
    }

    private RegistrationAttemptResult runAttempt(int attempt, Path presetFile, RegistrationJob job, RegistrationInputs inputs, Path workingDir) {
        logger.info("Loading settings from file {}.", presetFile);
        RegistrationPreset preset = presetLoader.load(presetFile);
        if (job.getUseHistogramMatching() != null) {
            boolean useHistogramMatching = job.getUseHistogramMatching();
            logger.info("Overriding ({}abling) histogram matching for file {}", useHistogramMatching ? "en" : "dis", presetFile);
            preset.overrideHistogramMatching(useHistogramMatching);
        }
        ExternalCommand registrationCmd = antsCommandFactory.createRegistrationCommand(preset, inputs);
        String commandLine = registrationCmd.getCommandLine();
        logger.info("Retry #{}, commandline: \n{}", attempt, commandLine);
        writeCommandFile(workingDir.resolve(COMMAND_FILE), commandLine);

        ProcessOutput registrationOutput = processRunner.run(registrationCmd, workingDir);
        if (registrationOutput.succeeded()) {
            return RegistrationAttemptResult.success(attempt,
                    antsCommandFactory.locateOutputs(preset, workingDir, inputs.getReferenceImage()));
        }
        List<Path> attemptLogs = registrationOutput.saveStreams(workingDir, String.format(ATTEMPT_LOG_SUFFIX_FORMAT, attempt));
        logger.info("Log of failed retry saved ({}).", attemptLogs);
        return RegistrationAttemptResult.failure(attempt, registrationOutput.getExitCode(), attemptLogs);
    }

    private void createWorkingDir(Path workingDir) {
        try {
            Files.createDirectories(workingDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeCommandFile(Path commandFile, String commandLine) {
        try {
            Files.write(commandFile, (commandLine + "\n\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<String> toStrings(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.toList());
    }
}
