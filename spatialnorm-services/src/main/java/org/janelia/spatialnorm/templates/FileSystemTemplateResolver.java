package org.janelia.spatialnorm.templates;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.janelia.spatialnorm.cdi.qualifier.PropertyValue;
import org.janelia.spatialnorm.exceptions.MissingDataException;
import org.janelia.spatialnorm.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Template resolver for a local TemplateFlow archive, i.e. files named
 * {@code tpl-<id>/[cohort-<n>/]tpl-<id>[_<entity>-<value>]..._<suffix>.nii.gz}.
 */
public class FileSystemTemplateResolver implements TemplateResolver {

    private static final String TEMPLATEFLOW_HOME_ENV = "TEMPLATEFLOW_HOME";
    private static final String RESOLUTION_ENTITY = "res";
    private static final String SUFFIX_ENTITY = "suffix";
    private static final String COHORT_ENTITY = "cohort";
    private static final String ATLAS_ENTITY = "atlas";

    private final Path templatesHome;
    private final Logger logger;

    @Inject
    public FileSystemTemplateResolver(@PropertyValue(name = "Templates.Home") String templatesHome, Logger logger) {
        this(getTemplatesHome(templatesHome, System.getenv(TEMPLATEFLOW_HOME_ENV)), logger);
    }

    public FileSystemTemplateResolver(Path templatesHome, Logger logger) {
        this.templatesHome = templatesHome;
        this.logger = logger;
    }

    @VisibleForTesting
    static Path getTemplatesHome(String configuredHome, String envHome) {
        if (StringUtils.isNotBlank(configuredHome)) {
            return Paths.get(configuredHome);
        } else if (StringUtils.isNotBlank(envHome)) {
            return Paths.get(envHome);
        } else {
            return Paths.get(System.getProperty("user.home"), ".cache", "templateflow");
        }
    }

    public Path getTemplatesHome() {
        return templatesHome;
    }

    @Override
    public List<Path> getTemplate(String templateId, Map<String, String> templateSpec) {
        Path templateDir = templatesHome.resolve("tpl-" + templateId);
        if (Files.notExists(templateDir)) {
            logger.warn("Template {} not found in {}", templateId, templatesHome);
            return ImmutableList.of();
        }
        Map<String, String> filter = normalizeSpec(templateSpec);
        try (Stream<Path> templateFiles = FileUtils.lookupFiles(templateDir, 2, "tpl-" + templateId + "_*.{nii,nii.gz}")) {
            return templateFiles
                    .filter(p -> matches(parseEntities(p.getFileName().toString()), filter))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public ResolvedTemplate getTemplateSpecs(String templateId, Map<String, String> templateSpec, int defaultResolution, boolean fallback) {
        Map<String, String> spec = new HashMap<>(templateSpec);
        if (!spec.containsKey(ATLAS_ENTITY)) {
            spec.put(ATLAS_ENTITY, null);
        }
        String resolution = spec.containsKey(RESOLUTION_ENTITY) ? spec.remove(RESOLUTION_ENTITY) : spec.get("resolution");
        spec.remove("resolution");
        if (StringUtils.isBlank(resolution)) {
            resolution = String.valueOf(defaultResolution);
        }
        spec.put(RESOLUTION_ENTITY, resolution);

        List<Path> candidates = getTemplate(templateId, spec);
        if (candidates.isEmpty() && fallback) {
            logger.info("No {} template found at resolution {} for {} - falling back to the lowest available resolution",
                    templateId, resolution, templateSpec);
            Map<String, String> anyResolutionSpec = new HashMap<>(spec);
            anyResolutionSpec.remove(RESOLUTION_ENTITY);
            List<Path> anyResolutionCandidates = getTemplate(templateId, anyResolutionSpec);
            Integer lowestResolution = anyResolutionCandidates.stream()
                    .map(p -> getResolution(parseEntities(p.getFileName().toString())))
                    .min(Comparator.naturalOrder())
                    .orElse(null);
            candidates = anyResolutionCandidates.stream()
                    .filter(p -> getResolution(parseEntities(p.getFileName().toString())).equals(lowestResolution))
                    .collect(Collectors.toList());
        }
        if (candidates.isEmpty()) {
            throw new MissingDataException("No template " + templateId + " found for " + spec + " in " + templatesHome);
        } else if (candidates.size() > 1) {
            throw new MissingDataException("Template " + templateId + " specification " + spec + " is ambiguous: " + candidates);
        }
        Path templateImage = candidates.get(0);
        Map<String, String> templateEntities = parseEntities(templateImage.getFileName().toString());
        Map<String, String> commonSpec = new LinkedHashMap<>();
        if (templateEntities.containsKey(RESOLUTION_ENTITY)) {
            commonSpec.put(RESOLUTION_ENTITY, String.valueOf(getResolution(templateEntities)));
        }
        if (templateEntities.containsKey(COHORT_ENTITY)) {
            commonSpec.put(COHORT_ENTITY, templateEntities.get(COHORT_ENTITY));
        }
        logger.debug("Resolved template {} for {} to {}", templateId, templateSpec, templateImage);
        return new ResolvedTemplate(templateImage.toAbsolutePath(), commonSpec);
    }

    private Map<String, String> normalizeSpec(Map<String, String> templateSpec) {
        Map<String, String> filter = new HashMap<>();
        templateSpec.forEach((k, v) -> filter.put("resolution".equals(k) ? RESOLUTION_ENTITY : k, v));
        return filter;
    }

    private boolean matches(Map<String, String> entities, Map<String, String> filter) {
        return filter.entrySet().stream().allMatch(e -> {
            String actual = entities.get(e.getKey());
            if (StringUtils.isEmpty(e.getValue())) {
                return actual == null;
            } else if (actual == null) {
                return false;
            } else if (RESOLUTION_ENTITY.equals(e.getKey())) {
                return StringUtils.isNumeric(e.getValue()) && StringUtils.isNumeric(actual)
                        && Integer.parseInt(e.getValue()) == Integer.parseInt(actual);
            } else {
                return e.getValue().equals(actual);
            }
        });
    }

    private Integer getResolution(Map<String, String> entities) {
        String res = entities.get(RESOLUTION_ENTITY);
        return StringUtils.isNumeric(res) ? Integer.valueOf(res) : Integer.MAX_VALUE;
    }

    /**
     * Split a TemplateFlow file name into its entities; the last name component is returned as the "suffix" entity.
     */
    @VisibleForTesting
    static Map<String, String> parseEntities(String fileName) {
        String baseName = FileUtils.getFileNameOnly(fileName);
        String[] components = StringUtils.split(baseName, '_');
        Map<String, String> entities = new LinkedHashMap<>();
        for (int i = 0; i < components.length; i++) {
            String component = components[i];
            int separatorIndex = component.indexOf('-');
            if (i == components.length - 1 && separatorIndex < 0) {
                entities.put(SUFFIX_ENTITY, component);
            } else if (separatorIndex > 0) {
                entities.put(component.substring(0, separatorIndex), component.substring(separatorIndex + 1));
            }
        }
        return entities;
    }
}
