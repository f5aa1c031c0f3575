package com.mlab.telescope.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Labels describing where a work item came from, used in log lines and filenames.
 */
@Value
@Builder
public class QueryMetadata {

    /** Start time formatted as yyyy-MM-dd-HHmmss. */
    String date;

    /** Compact duration such as "30d" or "1d6h". */
    String duration;

    String site;
    String clientProvider;
    String clientCountry;
    Metric metric;

    /** Comma separated non-null labels for log output. */
    public String describe() {
        return Stream.of(date, duration, site, clientProvider, clientCountry, String.valueOf(metric))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));
    }
}
