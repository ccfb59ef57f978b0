package org.janelia.spatialnorm.cdi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spatialnorm.config.ApplicationConfig;
import org.janelia.spatialnorm.config.ApplicationConfigImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the application configuration from, in increasing order of precedence: system properties,
 * the process environment (as <code>env.NAME</code>), the bundled <code>/spatialnorm.properties</code>,
 * an optional properties file named by an environment variable and the <code>-D</code> command line arguments.
 * An environment variable <code>SPATIALNORM_A_B</code> is also visible as property <code>A.B</code>.
 */
public class ApplicationConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfigProvider.class);

    private static final String BUNDLED_CONFIG_RESOURCE = "/spatialnorm.properties";
    private static final String ENV_OVERRIDE_PREFIX = "env.spatialnorm_";

    private static final Map<String, String> APP_DYNAMIC_ARGS = new HashMap<>();

    public static Map<String, String> getAppDynamicArgs() {
        return APP_DYNAMIC_ARGS;
    }

    public static void setAppDynamicArgs(Map<String, String> appDynamicArgs) {
        APP_DYNAMIC_ARGS.putAll(appDynamicArgs);
    }

    private final ApplicationConfig applicationConfig = new ApplicationConfigImpl();

    public ApplicationConfigProvider fromDefaultResources() {
        applicationConfig.putAll(Maps.fromProperties(System.getProperties()));
        applicationConfig.putAll(System.getenv().entrySet().stream()
                .collect(Collectors.toMap(e -> "env." + e.getKey(), Map.Entry::getValue)));
        return fromResource(BUNDLED_CONFIG_RESOURCE);
    }

    public ApplicationConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = this.getClass().getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Configuration resource {} not found", resourceName);
            } else {
                LOG.info("Reading application config from resource {}", resourceName);
                applicationConfig.load(configStream);
            }
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Load the properties file named by the given environment variable, if the variable is set.
     */
    public ApplicationConfigProvider fromEnvVar(String envVarName) {
        String configFileName = System.getenv(envVarName);
        if (StringUtils.isBlank(configFileName)) {
            return this;
        }
        Path configFile = Paths.get(configFileName);
        if (!Files.isRegularFile(configFile)) {
            LOG.warn("Configuration file {} set in {} not found", configFile, envVarName);
            return this;
        }
        try (InputStream configStream = Files.newInputStream(configFile)) {
            LOG.info("Reading application config from {} -> {}", envVarName, configFile);
            applicationConfig.load(configStream);
            return this;
        } catch (IOException e) {
            LOG.error("Error reading configuration file {}", configFile, e);
            throw new UncheckedIOException(e);
        }
    }

    public ApplicationConfigProvider fromMap(Map<String, String> properties) {
        applicationConfig.putAll(properties);
        return this;
    }

    public ApplicationConfig build() {
        Map<String, String> envOverrides = applicationConfig.asMap().entrySet().stream()
                .filter(e -> StringUtils.startsWithIgnoreCase(e.getKey(), ENV_OVERRIDE_PREFIX))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(ENV_OVERRIDE_PREFIX.length()).replace('_', '.'),
                        Map.Entry::getValue,
                        (v1, v2) -> v2));
        LOG.debug("Environment overrides {}", envOverrides);
        applicationConfig.putAll(envOverrides);
        return applicationConfig;
    }
}
