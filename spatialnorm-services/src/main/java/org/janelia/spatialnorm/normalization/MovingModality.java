package org.janelia.spatialnorm.normalization;

import java.util.stream.Stream;

import org.janelia.spatialnorm.exceptions.ConfigurationException;

/**
 * Modality of the image being registered.
 */
public enum MovingModality {
    T1W("T1w"),
    BOLDREF("boldref");

    private final String value;

    MovingModality(String value) {
        this.value = value;
    }

    public static MovingModality fromValue(String value) {
        return Stream.of(values())
                .filter(m -> m.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported moving image modality: " + value));
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
