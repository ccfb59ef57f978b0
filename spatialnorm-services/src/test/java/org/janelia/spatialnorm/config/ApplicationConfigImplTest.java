package org.janelia.spatialnorm.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableMap;
import org.janelia.spatialnorm.cdi.ApplicationConfigProvider;
import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class ApplicationConfigImplTest {

    @Test
    public void resolvePlaceholders() throws IOException {
        ApplicationConfig applicationConfig = new ApplicationConfigImpl();
        applicationConfig.load(new ByteArrayInputStream((
                "ANTs.Path=${Tools.Root}/ants/bin\n"
                        + "Tools.Root=/opt/tools\n"
                        + "Templates.Home=${Unknown.Root}/templateflow\n").getBytes(StandardCharsets.UTF_8)));

        assertThat(applicationConfig.getStringPropertyValue("ANTs.Path"), equalTo("/opt/tools/ants/bin"));
        assertThat(applicationConfig.getStringPropertyValue("Templates.Home"), equalTo("${Unknown.Root}/templateflow"));
        assertThat(applicationConfig.getStringPropertyValue("Missing.Property"), nullValue());
        assertThat(applicationConfig.getStringPropertyValue("Missing.Property", "default"), equalTo("default"));
        assertThat(applicationConfig.asMap(), hasEntry("ANTs.Path", "/opt/tools/ants/bin"));
    }

    @Test(expected = IllegalStateException.class)
    public void circularPlaceholders() {
        ApplicationConfig applicationConfig = new ApplicationConfigImpl();
        applicationConfig.putAll(ImmutableMap.of("A", "${B}", "B", "x${A}"));

        applicationConfig.getStringPropertyValue("A");
    }

    @Test
    public void dynamicArgsOverrideBundledProperties() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromMap(ImmutableMap.of("ANTs.Registration.Executable", "/usr/local/bin/antsRegistration"))
                .build();

        assertThat(applicationConfig.getStringPropertyValue("ANTs.Registration.Executable"), equalTo("/usr/local/bin/antsRegistration"));
        assertThat(applicationConfig.getStringPropertyValue("ANTs.AffineInitializer.Executable"), equalTo("antsAffineInitializer"));
        assertThat(applicationConfig.getStringPropertyValue("SpatialNormalization.DefaultTemplate"), equalTo("MNI152NLin2009cAsym"));
    }

    @Test
    public void missingConfigSourcesAreSkipped() {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/missing-spatialnorm.properties")
                .fromEnvVar("SPATIALNORM_CONFIG_NOT_SET")
                .fromMap(ImmutableMap.of("ANTs.Path", "/opt/ants/bin"))
                .build();

        assertThat(applicationConfig.asMap(), equalTo(ImmutableMap.of("ANTs.Path", "/opt/ants/bin")));
    }
}
