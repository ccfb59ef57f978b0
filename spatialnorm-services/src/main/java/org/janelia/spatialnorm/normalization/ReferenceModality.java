package org.janelia.spatialnorm.normalization;

import java.util.stream.Stream;

import org.janelia.spatialnorm.exceptions.ConfigurationException;

/**
 * Modality of the template image used as the registration target.
 */
public enum ReferenceModality {
    T1W("T1w"),
    T2W("T2w"),
    BOLDREF("boldref"),
    PDW("PDw");

    private final String value;

    ReferenceModality(String value) {
        this.value = value;
    }

    public static ReferenceModality fromValue(String value) {
        return Stream.of(values())
                .filter(m -> m.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported reference modality: " + value));
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
