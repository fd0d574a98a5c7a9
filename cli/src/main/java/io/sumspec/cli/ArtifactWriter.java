// file: cli/src/main/java/io/sumspec/cli/ArtifactWriter.java
package io.sumspec.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes generated documents to disk.
 *
 * Responsibilities:
 *  - Create missing parent directories.
 *  - Write UTF-8, replacing existing files.
 *  - Log one INFO line per file written.
 */
public final class ArtifactWriter {
    private static final Logger log = Logger.getLogger(ArtifactWriter.class.getName());

    private ArtifactWriter() {
        // utility
    }

    public static Path write(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.log(Level.INFO, String.format("wrote %s (%d chars)", target, content.length()));
        return target;
    }

    /** Writes each {@code file name -> content} entry under {@code dir}, in map order. */
    public static List<Path> writeAll(Path dir, Map<String, String> files) {
        List<Path> written = new ArrayList<>(files.size());
        for (Map.Entry<String, String> e : files.entrySet()) {
            written.add(write(dir.resolve(e.getKey()), e.getValue()));
        }
        return written;
    }
}
