package org.janelia.spatialnorm.app;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import jakarta.enterprise.inject.se.SeContainer;
import jakarta.enterprise.inject.se.SeContainerInitializer;
import jakarta.enterprise.util.AnnotationLiteral;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.spatialnorm.cdi.ApplicationConfigProvider;
import org.janelia.spatialnorm.cdi.qualifier.ApplicationProperties;
import org.janelia.spatialnorm.common.ComputationException;
import org.janelia.spatialnorm.config.ApplicationConfig;
import org.janelia.spatialnorm.exceptions.PresetsExhaustedException;
import org.janelia.spatialnorm.normalization.RegistrationJob;
import org.janelia.spatialnorm.normalization.SpatialNormalizationProcessor;
import org.janelia.spatialnorm.normalization.SpatialNormalizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line application that runs one robust spatial normalization job.
 */
public class SpatialNormalizationApp {

    private static final Logger LOG = LoggerFactory.getLogger(SpatialNormalizationApp.class);

    static final int SUCCESS = 0;
    static final int FAILURE = 1;
    static final int INVALID_ARGS = 2;

    private static class ApplicationPropertiesLiteral extends AnnotationLiteral<ApplicationProperties> implements ApplicationProperties {
    }

    public static void main(String[] args) {
        SpatialNormalizationArgs appArgs = new SpatialNormalizationArgs();
        try {
            parseAppArgs(args, appArgs);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(displayAppUsage(appArgs));
            System.exit(INVALID_ARGS);
            return;
        }
        if (appArgs.displayUsage) {
            System.out.println(displayAppUsage(appArgs));
            return;
        }
        System.exit(new SpatialNormalizationApp().run(appArgs, System.out));
    }

    static <A extends AppArgs> A parseAppArgs(String[] args, A appArgs) {
        JCommander cmdline = new JCommander(appArgs);
        cmdline.parse(args);
        // update the dynamic config
        ApplicationConfigProvider.setAppDynamicArgs(appArgs.appDynamicConfig);
        return appArgs;
    }

    static <A extends AppArgs> String displayAppUsage(A appArgs) {
        StringBuilder output = new StringBuilder();
        JCommander cmdline = new JCommander(appArgs);
        cmdline.getUsageFormatter().usage(output);
        return output.toString();
    }

    int run(SpatialNormalizationArgs appArgs, PrintStream output) {
        SeContainerInitializer containerInit = SeContainerInitializer.newInstance();
        try (SeContainer container = containerInit.initialize()) {
            ApplicationConfig applicationConfig = container.select(ApplicationConfig.class, new ApplicationPropertiesLiteral()).get();
            SpatialNormalizationProcessor processor = container.select(SpatialNormalizationProcessor.class).get();
            ObjectMapper objectMapper = container.select(ObjectMapper.class).get();

            RegistrationJob job = appArgs.toRegistrationJob(
                    applicationConfig.getStringPropertyValue("SpatialNormalization.DefaultTemplate", RegistrationJob.DEFAULT_TEMPLATE));
            Path workingDir = Paths.get(appArgs.workingDir).toAbsolutePath();
            SpatialNormalizationResult result = processor.process(job, workingDir);
            output.println(objectMapper.writeValueAsString(result));
            return SUCCESS;
        } catch (PresetsExhaustedException e) {
            LOG.error("{} Logs of the failed attempts: {}", e.getMessage(), e.getFailureLogs());
            return FAILURE;
        } catch (ComputationException | UncheckedIOException | IllegalArgumentException e) {
            LOG.error("Spatial normalization of {} failed", appArgs.movingImage, e);
            return FAILURE;
        } catch (JsonProcessingException e) {
            LOG.error("Error writing the spatial normalization result", e);
            return FAILURE;
        }
    }
}
