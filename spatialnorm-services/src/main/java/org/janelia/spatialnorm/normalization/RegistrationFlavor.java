package org.janelia.spatialnorm.normalization;

import java.util.stream.Stream;

import org.janelia.spatialnorm.exceptions.ConfigurationException;

/**
 * Registration presets tier, trading accuracy for speed.
 */
public enum RegistrationFlavor {
    PRECISE("precise", 1),
    FAST("fast", 2),
    TESTING("testing", 2);

    private final String value;
    private final int defaultTemplateResolution;

    RegistrationFlavor(String value, int defaultTemplateResolution) {
        this.value = value;
        this.defaultTemplateResolution = defaultTemplateResolution;
    }

    public static RegistrationFlavor fromValue(String value) {
        return Stream.of(values())
                .filter(f -> f.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported registration flavor: " + value));
    }

    public String getValue() {
        return value;
    }

    public int getDefaultTemplateResolution() {
        return defaultTemplateResolution;
    }

    @Override
    public String toString() {
        return value;
    }
}
