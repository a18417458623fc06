package org.janelia.atlasreg.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

import org.apache.commons.lang3.StringUtils;

public class FileUtils {

    public static Path createParentDirs(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory " + parent, e);
            }
        }
        return file;
    }

    /**
     * Deletes the given directory even if it's non empty.
     */
    public static void deletePath(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Copy the file into the target directory, prefixing its name.
     */
    public static Path copyWithPrefix(Path source, Path targetDir, String prefix) {
        Path target = targetDir.resolve(StringUtils.defaultString(prefix) + source.getFileName().toString());
        try {
            Files.createDirectories(targetDir);
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Error copying " + source + " to " + target, e);
        }
    }

    /**
     * @return the file name without directory and without its extensions, e.g. "a" for "/data/a.nrrd.gz"
     */
    public static String getFileNameOnly(Path fp) {
        if (fp == null || fp.getFileName() == null) {
            return "";
        }
        String fileName = fp.getFileName().toString();
        int extensionIndex = fileName.indexOf('.');
        return extensionIndex > 0 ? fileName.substring(0, extensionIndex) : fileName;
    }

    public static Path getFilePath(Path dir, String prefix, Path original, String extension) {
        return dir.resolve(StringUtils.defaultString(prefix) + getFileNameOnly(original) + StringUtils.prependIfMissing(extension, "."));
    }
}
