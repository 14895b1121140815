package com.driftwatch.core.arrival;

import com.driftwatch.core.config.PipelineConfig;
import com.driftwatch.core.error.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds data files in the source directory that the ingested-file ledger does
 * not know yet.
 */
@Component
public class ArrivalDetector {

    private static final Logger log = LoggerFactory.getLogger(ArrivalDetector.class);

    private final String extension;

    @Autowired
    public ArrivalDetector(PipelineConfig config) {
        this(config.fileExtension());
    }

    public ArrivalDetector(String extension) {
        this.extension = extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the basenames of regular files directly under {@code sourceDir}
     * that carry the configured extension and are not in {@code knownFiles}.
     *
     * @throws SourceUnavailableException if the directory is missing or unreadable
     */
    public Set<String> detectNewFiles(Path sourceDir, Set<String> knownFiles) {
        Set<String> unseen = new TreeSet<>();
        for (String name : listDataFiles(sourceDir)) {
            if (!knownFiles.contains(name)) {
                unseen.add(name);
            }
        }
        log.info("Arrival check on {}: {} known, {} new {}", sourceDir, knownFiles.size(), unseen.size(), unseen);
        return unseen;
    }

    /**
     * Basenames of all data files directly under {@code sourceDir}, sorted.
     *
     * @throws SourceUnavailableException if the directory is missing or unreadable
     */
    public Set<String> listDataFiles(Path sourceDir) {
        if (!Files.isDirectory(sourceDir)) {
            throw new SourceUnavailableException(sourceDir,
                    Files.exists(sourceDir) ? "not a directory" : "does not exist");
        }
        Set<String> names = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(sourceDir)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry) && matchesExtension(entry)) {
                    names.add(entry.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(sourceDir, "cannot list: " + e.getMessage(), e);
        }
        return names;
    }

    public String extension() {
        return extension;
    }

    private boolean matchesExtension(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }
}
