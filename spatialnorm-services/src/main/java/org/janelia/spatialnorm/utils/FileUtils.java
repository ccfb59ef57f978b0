package org.janelia.spatialnorm.utils;

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.stream.Stream;

public class FileUtils {

    private static final String[] COMPOUND_EXTENSIONS = {".nii.gz", ".tar.gz"};

    /**
     * Find the regular files under dir whose name matches the pattern. The stream must be closed by the caller.
     * A pattern without a "glob:" or "regex:" prefix is treated as a glob.
     */
    public static Stream<Path> lookupFiles(Path dir, int maxDepth, String pattern) {
        try {
            String fileLookupPattern;
            if (StringUtils.isBlank(pattern)) {
                fileLookupPattern = "glob:*";
            } else if (!pattern.startsWith("glob:") && !pattern.startsWith("regex:")) {
                // default to glob
                fileLookupPattern = "glob:" + pattern;
            } else {
                fileLookupPattern = pattern;
            }
            PathMatcher inputFileMatcher = dir.getFileSystem().getPathMatcher(fileLookupPattern);
            return Files.find(dir, maxDepth, (p, a) -> a.isRegularFile() && inputFileMatcher.matches(p.getFileName()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static boolean fileExists(String filepath) {
        return StringUtils.isNotBlank(filepath) && Files.exists(Paths.get(filepath));
    }

    public static boolean fileNotExists(String filepath) {
        return !fileExists(filepath);
    }

    /**
     * Deletes the given directory even if it's non empty.
     */
    public static void deletePath(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir)) {
            return; // do nothing
        }
        Files.walkFileTree(dir, new FileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public static String getFileName(String fn) {
        return StringUtils.isBlank(fn) ? "" : Paths.get(fn).getFileName().toString();
    }

    /**
     * @return the file name without directory and extension; ".nii.gz" is stripped as a whole
     */
    public static String getFileNameOnly(String fn) {
        String fileName = getFileName(fn);
        String ext = getFileExtensionOnly(fileName);
        return fileName.substring(0, fileName.length() - ext.length());
    }

    /**
     * @return the extension including the leading dot, or an empty string
     */
    public static String getFileExtensionOnly(String fn) {
        String fileName = getFileName(fn);
        for (String compoundExt : COMPOUND_EXTENSIONS) {
            if (StringUtils.endsWithIgnoreCase(fileName, compoundExt) && fileName.length() > compoundExt.length()) {
                return fileName.substring(fileName.length() - compoundExt.length());
            }
        }
        String ext = com.google.common.io.Files.getFileExtension(fileName);
        return StringUtils.isBlank(ext) ? "" : "." + ext;
    }

    /**
     * Build dir/prefix + name(fileName) + suffix + ext, where the extension defaults to the one of fileName.
     */
    public static Path getFilePath(Path dir, String prefix, String fileName, String suffix, String fileExt) {
        String actualFileName = String.format("%s%s%s%s",
                StringUtils.defaultIfBlank(prefix, ""),
                FileUtils.getFileNameOnly(fileName),
                StringUtils.defaultIfBlank(suffix, ""),
                getExtension(fileName, fileExt));
        return dir != null ? dir.resolve(actualFileName) : Paths.get(actualFileName);
    }

    private static String getExtension(String fileName, String fileExt) {
        if (fileExt == null) {
            return getFileExtensionOnly(fileName);
        } else if (StringUtils.isBlank(fileExt)) {
            return "";
        } else {
            return StringUtils.prependIfMissing(fileExt, ".");
        }
    }
}
