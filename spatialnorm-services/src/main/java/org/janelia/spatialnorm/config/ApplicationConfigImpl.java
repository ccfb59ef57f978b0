package org.janelia.spatialnorm.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public class ApplicationConfigImpl implements ApplicationConfig {

    private final Map<String, String> rawProperties = new LinkedHashMap<>();
    private final ConfigValueResolver valueResolver = new ConfigValueResolver();

    @Override
    public String getStringPropertyValue(String name) {
        return valueResolver.resolve(rawProperties.get(name), rawProperties::get);
    }

    @Override
    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value != null ? value : defaultValue;
    }

    @Override
    public void load(InputStream stream) throws IOException {
        Properties loadedProperties = new Properties();
        loadedProperties.load(stream);
        putAll(Maps.fromProperties(loadedProperties));
    }

    @Override
    public void putAll(Map<String, String> properties) {
        properties.forEach((name, value) -> {
            if (name != null && value != null) {
                rawProperties.put(name, value);
            }
        });
    }

    /**
     * @return all properties with their placeholders expanded
     */
    @Override
    public Map<String, String> asMap() {
        ImmutableMap.Builder<String, String> resolvedProperties = ImmutableMap.builder();
        rawProperties.keySet().forEach(name -> resolvedProperties.put(name, getStringPropertyValue(name)));
        return resolvedProperties.build();
    }
}
