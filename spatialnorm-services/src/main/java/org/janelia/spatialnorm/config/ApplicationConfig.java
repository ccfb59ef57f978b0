package org.janelia.spatialnorm.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Layered string properties of the spatial normalization tools. Later layers override earlier ones and
 * values may reference other properties as <code>${name}</code>.
 */
public interface ApplicationConfig {
    String getStringPropertyValue(String name);
    String getStringPropertyValue(String name, String defaultValue);
    void load(InputStream stream) throws IOException;
    void putAll(Map<String, String> properties);
    Map<String, String> asMap();
}
