package org.janelia.spatialnorm.config;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands <code>${name}</code> references inside a property value using the other properties.
 * An unknown reference is left in place.
 */
public class ConfigValueResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    public String resolve(String value, Function<String, String> valueProvider) {
        return resolve(value, valueProvider, new HashSet<>());
    }

    private String resolve(String value, Function<String, String> valueProvider, Set<String> visited) {
        if (value == null || value.indexOf('$') == -1) {
            return value;
        }
        Matcher m = PLACEHOLDER.matcher(value);
        StringBuffer resolved = new StringBuffer();
        while (m.find()) {
            String key = m.group(1);
            String replacement;
            if (visited.contains(key)) {
                throw new IllegalStateException("Circular reference detected while resolving ${" + key + "}");
            }
            String keyValue = valueProvider.apply(key);
            if (keyValue == null) {
                replacement = m.group(0);
            } else {
                visited.add(key);
                replacement = resolve(keyValue, valueProvider, visited);
                visited.remove(key);
            }
            m.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(resolved);
        return resolved.toString();
    }
}
