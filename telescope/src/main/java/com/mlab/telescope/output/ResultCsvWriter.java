package com.mlab.telescope.output;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.ResultRow;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes reduced rows as timestamp,value CSV lines.
 *
 * Writes are retried a bounded number of times, since a run with many
 * concurrent jobs can briefly exhaust file handles. A write that still fails
 * is logged and reported to the caller; it does not stop the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResultCsvWriter implements ResultSink {

    private static final String[] HEADERS = {"timestamp", "value"};

    private final TelescopeProperties properties;

    @Override
    public boolean write(Path outputPath, List<ResultRow> rows) {
        TelescopeProperties.Output output = properties.getOutput();
        int attempts = Math.max(1, output.getWriteAttempts());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                writeOnce(outputPath, rows, output.isIncludeHeader());
                log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
                return true;
            } catch (IOException e) {
                log.error("When writing raw output to {}, caught {} (attempt {} of {}).",
                        outputPath, e.getMessage(), attempt, attempts);
            }

            if (attempt < attempts && !sleep(output.getWriteRetryDelay().toMillis())) {
                break;
            }
        }

        log.error("Giving up writing {}.", outputPath);
        return false;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void writeOnce(Path outputPath, List<ResultRow> rows, boolean includeHeader) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer fileWriter = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     fileWriter,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.NO_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     "\n")) {

            if (includeHeader) {
                writer.writeNext(HEADERS);
            }
            for (ResultRow row : rows) {
                writer.writeNext(toRow(row));
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("CSV writer reported an error for " + outputPath);
            }
        }
    }

    private String[] toRow(ResultRow row) {
        return new String[]{
                String.valueOf(row.timestamp()),
                BigDecimal.valueOf(row.value()).toPlainString()
        };
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
