package org.janelia.spatialnorm.data;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.janelia.spatialnorm.cdi.qualifier.PropertyValue;
import org.janelia.spatialnorm.exceptions.MissingDataException;
import org.slf4j.Logger;

/**
 * Locates the data files distributed with the application, such as the registration presets.
 */
public class BundledDataLocator {

    static final String BUNDLED_DATA_RESOURCE = "/data";

    private final String configuredDataDir;
    private final Logger logger;

    @Inject
    public BundledDataLocator(@PropertyValue(name = "SpatialNormalization.DataDir") String configuredDataDir, Logger logger) {
        this.configuredDataDir = configuredDataDir;
        this.logger = logger;
    }

    /**
     * @return the configured data directory or, if none is configured, the bundled data folder which may reside
     * inside the application jar
     */
    public Path getDataDir() {
        if (StringUtils.isNotBlank(configuredDataDir)) {
            return Paths.get(configuredDataDir);
        }
        URL dataURL = BundledDataLocator.class.getResource(BUNDLED_DATA_RESOURCE);
        if (dataURL == null) {
            throw new MissingDataException("No bundled data found in the classpath");
        }
        try {
            URI dataURI = dataURL.toURI();
            if ("jar".equals(dataURI.getScheme())) {
                logger.debug("Open bundled data from {}", dataURI);
                return getJarFileSystem(dataURI).provider().getPath(dataURI);
            } else {
                return Paths.get(dataURI);
            }
        } catch (URISyntaxException e) {
            throw new MissingDataException("Invalid bundled data location " + dataURL, e);
        }
    }

    private FileSystem getJarFileSystem(URI jarURI) {
        try {
            return FileSystems.newFileSystem(jarURI, Collections.emptyMap());
        } catch (FileSystemAlreadyExistsException e) {
            return FileSystems.getFileSystem(jarURI);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
