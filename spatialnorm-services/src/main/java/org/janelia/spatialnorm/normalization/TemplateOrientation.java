package org.janelia.spatialnorm.normalization;

import org.janelia.spatialnorm.exceptions.ConfigurationException;

public enum TemplateOrientation {
    RAS,
    LAS;

    public static TemplateOrientation fromValue(String value) {
        try {
            return valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Unsupported template orientation: " + value, e);
        }
    }
}
