package com.qamigrate.compiler.frontend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the source files under a set of roots in sorted path order.
 *
 * Missing roots are skipped with a warning. An unreadable tree aborts, since a run that
 * silently drops files would produce an incomplete IR.
 */
public class SourceFileCollector {

    public static class SourceScanException extends RuntimeException {
        public SourceScanException(String message, Throwable cause) { super(message, cause); }
    }

    private final String extension;

    public SourceFileCollector() {
        this(".java");
    }

    public SourceFileCollector(String extension) {
        this.extension = extension;
    }

    public List<Path> collect(SourceRoots sourceRoots) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : sourceRoots.roots()) {
            if (!Files.isDirectory(root)) {
                System.err.println("[qa-migrate] WARNING: source root not found, skipped: " + root);
                continue;
            }
            try (Stream<Path> walk = Files.walk(root)) {
                files.addAll(walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .map(p -> p.toAbsolutePath().normalize())
                    .collect(Collectors.toList()));
            } catch (IOException | UncheckedIOException e) {
                throw new SourceScanException("Could not walk source tree " + root + ": " + e.getMessage(), e);
            }
        }
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(Path::toString));
        return sorted;
    }
}
