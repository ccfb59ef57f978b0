package org.janelia.spatialnorm.normalization;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import org.janelia.spatialnorm.data.BundledDataLocator;
import org.janelia.spatialnorm.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Enumerates the registration presets to try, in order.
 */
public class PresetLookup {

    private final BundledDataLocator dataLocator;
    private final Logger logger;

    @Inject
    public PresetLookup(BundledDataLocator dataLocator, Logger logger) {
        this.dataLocator = dataLocator;
        this.logger = logger;
    }

    /**
     * User defined settings take precedence and are returned as given. Otherwise the bundled presets for the
     * moving modality and the flavor are returned sorted by file name, which is what orders the stages.
     */
    public List<Path> getSettings(RegistrationJob job) {
        if (job.getSettings() != null) {
            logger.info("User-defined settings, overriding defaults");
            return job.getSettings().stream().map(Paths::get).collect(Collectors.toList());
        }
        return findPresets(dataLocator.getDataDir(), job.getMoving().getValue().toLowerCase(), job.getFlavor().getValue());
    }

    List<Path> findPresets(Path dataDir, String modality, String flavor) {
        String presetPattern = String.format("%s-mni_registration_%s_*.json", modality, flavor);
        try (Stream<Path> presets = FileUtils.lookupFiles(dataDir, 1, presetPattern)) {
            List<Path> presetFiles = presets
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
            logger.debug("Found {} presets for {} in {}: {}", presetFiles.size(), presetPattern, dataDir, presetFiles);
            return presetFiles;
        }
    }
}
