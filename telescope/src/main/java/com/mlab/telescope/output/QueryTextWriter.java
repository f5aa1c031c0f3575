package com.mlab.telescope.output;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves generated query text next to the results, for inspection or manual reruns.
 */
@Component
@Slf4j
public class QueryTextWriter {

    public void write(Path queryPath, String queryText) {
        try {
            Path parent = queryPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(queryPath, queryText, StandardCharsets.UTF_8);
            log.debug("Saved query text to {}", queryPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save query text to " + queryPath, e);
        }
    }
}
