package io.github.metahealth.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recursively discovers the compressed line-delimited data files below a directory.
 */
public class DataFileScanner {

    private static final Logger LOG = LoggerFactory.getLogger(DataFileScanner.class);

    public static final String DEFAULT_SUFFIX = ".jsonl.gz";

    private final String suffix;

    public DataFileScanner() {
        this(DEFAULT_SUFFIX);
    }

    public DataFileScanner(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Returns every regular file below {@code rootDir} whose name ends with the configured
     * suffix, sorted by path. A missing root yields an empty list.
     */
    public List<Path> discover(Path rootDir) {
        if (rootDir == null || !Files.isDirectory(rootDir)) {
            LOG.error("Input directory does not exist or is not a directory: {}", rootDir);
            return Collections.emptyList();
        }

        DataFileVisitor visitor = new DataFileVisitor();
        try {
            Files.walkFileTree(rootDir, visitor);
        } catch (IOException e) {
            LOG.error("Error scanning directory {}: {}", rootDir, e.getMessage());
            return Collections.emptyList();
        }

        List<Path> found = visitor.found;
        Collections.sort(found);
        if (found.isEmpty()) {
            LOG.warn("No {} files found in {}", suffix, rootDir);
        } else {
            LOG.debug("Discovered {} {} files in {}", found.size(), suffix, rootDir);
        }
        return found;
    }

    private class DataFileVisitor extends SimpleFileVisitor<Path> {
        private final List<Path> found = new ArrayList<>();

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && file.getFileName().toString().endsWith(suffix)) {
                found.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            LOG.warn("Cannot access {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
