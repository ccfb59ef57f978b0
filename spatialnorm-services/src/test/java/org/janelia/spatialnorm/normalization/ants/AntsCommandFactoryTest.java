package org.janelia.spatialnorm.normalization.ants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.spatialnorm.cdi.ObjectMapperFactory;
import org.janelia.spatialnorm.data.BundledDataLocator;
import org.janelia.spatialnorm.normalization.RegistrationInputs;
import org.janelia.spatialnorm.process.ExternalCommand;
import org.janelia.spatialnorm.utils.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.mockito.Mockito.mock;

public class AntsCommandFactoryTest {

    private static final String FIXED_IMAGE = "/work/fixed_masked.nii.gz";
    private static final String MOVING_IMAGE = "/data/sub-01_T1w.nii.gz";

    private AntsCommandFactory antsCommandFactory;
    private RegistrationPresetLoader presetLoader;
    private Path dataDir;
    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        Logger logger = mock(Logger.class);
        antsCommandFactory = new AntsCommandFactory("", "antsRegistration", "antsAffineInitializer");
        presetLoader = new RegistrationPresetLoader(ObjectMapperFactory.instance().newObjectMapper(), logger);
        dataDir = new BundledDataLocator(null, logger).getDataDir();
        testDirectory = Files.createTempDirectory("testAnts");
    }

    @After
    public void tearDown() throws IOException {
        FileUtils.deletePath(testDirectory);
    }

    private RegistrationInputs.Builder inputsBuilder() {
        return RegistrationInputs.builder()
                .fixedImage(FIXED_IMAGE)
                .movingImage(MOVING_IMAGE)
                .referenceImage(FIXED_IMAGE)
                .initialMovingTransform("/work/transform.mat")
                .numThreads(4);
    }

    @Test
    public void registrationCommand() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));

        ExternalCommand cmd = antsCommandFactory.createRegistrationCommand(preset, inputsBuilder().build());

        assertThat(cmd.getArgs(), contains(
                "antsRegistration",
                "--collapse-output-transforms", "1",
                "--dimensionality", "3",
                "--float", "0",
                "--initial-moving-transform", "[ /work/transform.mat, 0 ]",
                "--initialize-transforms-per-stage", "0",
                "--interpolation", "Linear",
                "--output", "[ ants_boldref_to_mni, ants_boldref_to_mniWarped.nii.gz ]",
                "--transform", "Rigid[ 0.1 ]",
                "--metric", "Mattes[ " + FIXED_IMAGE + ", " + MOVING_IMAGE + ", 1, 32, Random, 0.1 ]",
                "--convergence", "[ 20, 0.000001, 10 ]",
                "--smoothing-sigmas", "4vox",
                "--shrink-factors", "8",
                "--use-histogram-matching", "0",
                "--transform", "Affine[ 0.1 ]",
                "--metric", "Mattes[ " + FIXED_IMAGE + ", " + MOVING_IMAGE + ", 1, 32, Random, 0.1 ]",
                "--convergence", "[ 20, 0.000001, 10 ]",
                "--smoothing-sigmas", "4vox",
                "--shrink-factors", "8",
                "--use-histogram-matching", "0",
                "--winsorize-image-intensities", "[ 0.005, 0.995 ]",
                "--write-composite-transform", "1",
                "--verbose", "1"));
        assertThat(cmd.getEnv(), hasEntry(AntsCommandFactory.THREADS_ENV_VAR, "4"));
    }

    @Test
    public void multiResolutionStages() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("t1w-mni_registration_precise_000.json"));

        String commandLine = antsCommandFactory.createRegistrationCommand(preset, inputsBuilder().useFloat(true).build()).getCommandLine();

        assertThat(commandLine.contains("--float 1"), equalTo(true));
        assertThat(commandLine.contains("--transform SyN[ 0.1, 3, 0 ]"), equalTo(true));
        assertThat(commandLine.contains("--convergence [ 10000x1000x100, 0.0000001, 15 ]"), equalTo(true));
        assertThat(commandLine.contains("--metric CC[ " + FIXED_IMAGE + ", " + MOVING_IMAGE + ", 1, 4, None, 1 ]"), equalTo(true));
        assertThat(commandLine.contains("--smoothing-sigmas 4x2x1x0vox --shrink-factors 8x4x2x1 --use-histogram-matching 1"), equalTo(true));
    }

    @Test
    public void masksArePassedToEveryStage() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));

        ExternalCommand cmd = antsCommandFactory.createRegistrationCommand(preset,
                inputsBuilder().movingImageMask("/work/sub-01_T1w_cfm.nii.gz").build());

        long nMasks = cmd.getArgs().stream().filter("[ NULL, /work/sub-01_T1w_cfm.nii.gz ]"::equals).count();
        assertThat(nMasks, equalTo(2L));
    }

    @Test
    public void noMasksArgWithoutMasks() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));

        ExternalCommand cmd = antsCommandFactory.createRegistrationCommand(preset, inputsBuilder().build());

        assertThat(cmd.getArgs(), not(hasItem("--masks")));
    }

    @Test
    public void histogramMatchingOverride() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));
        preset.overrideHistogramMatching(true);

        String commandLine = antsCommandFactory.createRegistrationCommand(preset, inputsBuilder().build()).getCommandLine();

        assertThat(commandLine.contains("--use-histogram-matching 0"), equalTo(false));
        assertThat(commandLine.contains("--use-histogram-matching 1"), equalTo(true));
    }

    @Test
    public void outputWithoutWarpedImage() {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));
        preset.setOutputWarpedImage(false);

        ExternalCommand cmd = antsCommandFactory.createRegistrationCommand(preset, inputsBuilder().initialMovingTransform(null).build());

        String commandLine = cmd.getCommandLine();
        assertThat(commandLine.contains("--output ants_boldref_to_mni --transform"), equalTo(true));
        assertThat(cmd.getArgs(), not(hasItem("--initial-moving-transform")));
    }

    @Test
    public void executablesFromAntsPath() {
        AntsCommandFactory factory = new AntsCommandFactory("/opt/ants/bin", "antsRegistration", "antsAffineInitializer");

        ExternalCommand cmd = factory.createAffineInitializerCommand(FIXED_IMAGE, MOVING_IMAGE, 2);

        assertThat(cmd.getArgs(), contains(
                Paths.get("/opt/ants/bin", "antsAffineInitializer").toString(),
                "3", FIXED_IMAGE, MOVING_IMAGE, "transform.mat",
                "15.000000", "0.100000", "0", "10"));
        assertThat(cmd.getEnv(), hasEntry(AntsCommandFactory.THREADS_ENV_VAR, "2"));
    }

    @Test
    public void locateOutputs() throws IOException {
        RegistrationPreset preset = presetLoader.load(dataDir.resolve("boldref-mni_registration_testing_000.json"));
        preset.setOutputInverseWarpedImage(true);
        Files.createFile(testDirectory.resolve("ants_boldref_to_mniComposite.h5"));
        Files.createFile(testDirectory.resolve("ants_boldref_to_mniInverseComposite.h5"));
        Files.createFile(testDirectory.resolve("ants_boldref_to_mniWarped.nii.gz"));

        RegistrationOutputs outputs = antsCommandFactory.locateOutputs(preset, testDirectory, FIXED_IMAGE);

        assertThat(outputs.getCompositeTransform(), equalTo(testDirectory.resolve("ants_boldref_to_mniComposite.h5").toAbsolutePath().toString()));
        assertThat(outputs.getInverseCompositeTransform(), equalTo(testDirectory.resolve("ants_boldref_to_mniInverseComposite.h5").toAbsolutePath().toString()));
        assertThat(outputs.getWarpedImage(), equalTo(testDirectory.resolve("ants_boldref_to_mniWarped.nii.gz").toAbsolutePath().toString()));
        assertThat(outputs.getInverseWarpedImage(), nullValue());
        assertThat(outputs.getReferenceImage(), equalTo(FIXED_IMAGE));
    }
}
