package com.mlab.telescope.output;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.ResultRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCsvWriterTest {

    @TempDir
    Path outputDir;

    private TelescopeProperties properties;
    private ResultCsvWriter writer;

    @BeforeEach
    void setUp() {
        properties = new TelescopeProperties();
        properties.getOutput().setWriteRetryDelay(Duration.ofMillis(1));
        writer = new ResultCsvWriter(properties);
    }

    @Test
    void writesHeaderlessRows() throws IOException {
        Path output = outputDir.resolve("nested/result-raw.csv");

        boolean written = writer.write(output, List.of(new ResultRow(1391212800L, 1.5), new ResultRow(1391212801L, 42.0)));

        assertThat(written).isTrue();
        assertThat(Files.readAllLines(output)).containsExactly("1391212800,1.5", "1391212801,42.0");
    }

    @Test
    void writesHeaderWhenConfigured() throws IOException {
        properties.getOutput().setIncludeHeader(true);
        Path output = outputDir.resolve("result-raw.csv");

        writer.write(output, List.of(new ResultRow(1391212800L, 0.25)));

        assertThat(Files.readAllLines(output)).containsExactly("timestamp,value", "1391212800,0.25");
    }

    @Test
    void writesSmallValuesWithoutExponent() throws IOException {
        Path output = outputDir.resolve("result-raw.csv");

        writer.write(output, List.of(new ResultRow(1391212800L, 0.0005)));

        assertThat(Files.readAllLines(output)).containsExactly("1391212800,0.0005");
    }

    @Test
    void emptyResultsGiveEmptyFile() throws IOException {
        Path output = outputDir.resolve("result-raw.csv");

        assertThat(writer.write(output, List.of())).isTrue();
        assertThat(Files.size(output)).isZero();
    }

    @Test
    void reportsFailureAfterRetries() throws IOException {
        // A directory where the file should be makes every attempt fail.
        Path output = Files.createDirectory(outputDir.resolve("result-raw.csv"));

        assertThat(writer.write(output, List.of(new ResultRow(1391212800L, 1.5)))).isFalse();
    }
}
