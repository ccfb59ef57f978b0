package org.janelia.spatialnorm.templates;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Locates standard space templates and their companion files.
 *
 * A template spec maps an entity name (res, cohort, desc, label, suffix, atlas) to the value it must have.
 * A null or empty value requires the entity to be absent from the file name and a missing key accepts any value.
 */
public interface TemplateResolver {

    /**
     * @return all template files matching the spec, in lexicographic order
     */
    List<Path> getTemplate(String templateId, Map<String, String> templateSpec);

    /**
     * Resolve exactly one template image.
     *
     * @param templateId template identifier, e.g. MNI152NLin2009cAsym
     * @param templateSpec requested entities
     * @param defaultResolution resolution used when the spec does not set one
     * @param fallback if true and nothing matches the requested resolution the lowest available resolution is used
     * @return the resolved image together with the spec that identifies its companion files
     */
    ResolvedTemplate getTemplateSpecs(String templateId, Map<String, String> templateSpec, int defaultResolution, boolean fallback);
}
