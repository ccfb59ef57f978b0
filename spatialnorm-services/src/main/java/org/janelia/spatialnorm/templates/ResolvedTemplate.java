package org.janelia.spatialnorm.templates;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class ResolvedTemplate {

    private final Path image;
    private final Map<String, String> spec;

    public ResolvedTemplate(Path image, Map<String, String> spec) {
        this.image = image;
        this.spec = Collections.unmodifiableMap(new LinkedHashMap<>(spec));
    }

    public Path getImage() {
        return image;
    }

    /**
     * @return the entities shared by the image and its companion files (resolution and cohort)
     */
    public Map<String, String> getSpec() {
        return spec;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("image", image)
                .append("spec", spec)
                .toString();
    }
}
