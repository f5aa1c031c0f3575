package com.mlab.telescope.output;

import com.mlab.telescope.model.QueryMetadata;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Output file naming and the result-cache check.
 *
 * Filename pattern: {date}+{duration}_{site}_{country}_{provider}_{metric}{suffix}
 * e.g. 2014-02-01-000000+30d_iad01_us_comcast_download_throughput-raw.csv
 * Missing labels are left out along with their separator.
 */
public final class OutputPaths {

    public static final String RESULT_SUFFIX = "-raw.csv";
    public static final String QUERY_SUFFIX = "-bigquery.sql";

    private static final Pattern SPECIAL_CHARACTERS = Pattern.compile("[^A-Za-z0-9 ._\\-]");

    private OutputPaths() {
    }

    public static Path resultPath(Path outputDir, QueryMetadata metadata) {
        return outputDir.resolve(buildFilename(metadata, RESULT_SUFFIX));
    }

    public static Path queryPath(Path outputDir, QueryMetadata metadata) {
        return outputDir.resolve(buildFilename(metadata, QUERY_SUFFIX));
    }

    public static String buildFilename(QueryMetadata metadata, String suffix) {
        String labels = Stream.of(
                        metadata.getSite(),
                        metadata.getClientCountry(),
                        metadata.getClientProvider(),
                        metadata.getMetric() == null ? null : metadata.getMetric().getKey())
                .filter(Objects::nonNull)
                .map(OutputPaths::stripSpecialCharacters)
                .collect(Collectors.joining("_"));

        return stripSpecialCharacters(metadata.getDate()) + "+"
                + stripSpecialCharacters(metadata.getDuration()) + "_"
                + labels + suffix;
    }

    /**
     * Drop characters that are unsafe in filenames: "at&t" becomes "att".
     */
    public static String stripSpecialCharacters(String value) {
        return SPECIAL_CHARACTERS.matcher(value).replaceAll("");
    }

    /**
     * An existing, non-empty result file counts as a fresh cache entry.
     */
    public static boolean isCached(Path resultPath) {
        if (!Files.isRegularFile(resultPath)) {
            return false;
        }
        try {
            return Files.size(resultPath) > 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot inspect cached result " + resultPath, e);
        }
    }
}
