package com.mlab.telescope.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTextWriterTest {

    @TempDir
    Path outputDir;

    @Test
    void savesQueryText() throws IOException {
        Path queryPath = outputDir.resolve("queries/2014-02-01+30d_download_throughput-bigquery.sql");

        new QueryTextWriter().write(queryPath, "SELECT\n\tweb100_log_entry.log_time");

        assertThat(Files.readString(queryPath)).isEqualTo("SELECT\n\tweb100_log_entry.log_time");
    }
}
