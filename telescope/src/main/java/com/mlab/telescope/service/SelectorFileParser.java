package com.mlab.telescope.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlab.telescope.exception.SelectorParseException;
import com.mlab.telescope.exception.TelescopeException;
import com.mlab.telescope.model.IpTranslationSpec;
import com.mlab.telescope.model.Metric;
import com.mlab.telescope.model.Selector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses selector files, the JSON documents describing which datasets to fetch.
 *
 * Version 1.1 format:
 * <pre>
 * {
 *   "file_format_version": 1.1,
 *   "duration": "30d",
 *   "metrics": ["download_throughput", "minimum_rtt"],   // or "all"
 *   "ip_translation": {"strategy": "maxmind", "params": {"db_snapshots": ["2014-08-04"]}},
 *   "start_times": ["2014-02-01T00:00:00Z"],
 *   "sites": ["lga02"],                  // optional
 *   "client_providers": ["comcast"],     // optional
 *   "client_countries": ["us"]           // optional
 * }
 * </pre>
 * One selector is produced for every combination of the listed values.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SelectorFileParser {

    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");
    private static final Pattern DURATION_SEGMENT = Pattern.compile("([0-9]+)([a-zA-Z]+)");
    private static final double SUPPORTED_VERSION = 1.1;

    private final ObjectMapper objectMapper;

    /**
     * Parse every file, logging and skipping the ones that fail.
     */
    public List<Selector> parseAll(List<Path> selectorFiles) {
        List<Selector> selectors = new ArrayList<>();
        for (Path selectorFile : selectorFiles) {
            log.debug("Attempting to parse selector file at: {}", selectorFile);
            try {
                selectors.addAll(parse(selectorFile));
            } catch (TelescopeException e) {
                log.error("Failed to parse selector file {}: {}", selectorFile, e.getMessage());
            }
        }
        return selectors;
    }

    public List<Selector> parse(Path selectorFile) {
        try {
            return parseContents(Files.readString(selectorFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SelectorParseException("Could not read selector file " + selectorFile, e);
        }
    }

    public List<Selector> parseContents(String contents) {
        JsonNode root;
        try {
            root = objectMapper.readTree(contents);
        } catch (JsonProcessingException e) {
            throw new SelectorParseException("Selector file is not valid JSON: " + e.getOriginalMessage(), e);
        }
        validateVersion(root);

        long duration = parseDuration(required(root, "duration").asText());
        List<Metric> metrics = parseMetrics(required(root, "metrics"));
        IpTranslationSpec translation = parseIpTranslation(required(root, "ip_translation"));
        List<Instant> startTimes = requiredList(root, "start_times", SelectorFileParser::parseStartTime);
        List<String> sites = optionalList(root, "sites", Function.identity());
        List<String> providers = optionalList(root, "client_providers", Function.identity());
        List<String> countries = optionalList(root, "client_countries", c -> c.toLowerCase(Locale.ROOT));

        List<Selector> selectors = new ArrayList<>();
        for (Instant startTime : startTimes) {
            for (String country : countries) {
                for (String provider : providers) {
                    for (String site : sites) {
                        for (Metric metric : metrics) {
                            selectors.add(Selector.builder()
                                    .startTime(startTime)
                                    .durationSeconds(duration)
                                    .metric(metric)
                                    .ipTranslationSpec(translation)
                                    .clientCountry(country)
                                    .clientProvider(provider)
                                    .site(site)
                                    .build());
                        }
                    }
                }
            }
        }
        return selectors;
    }

    /**
     * Parse durations like "30d", "12h" or "1d6h30m" into seconds.
     */
    static long parseDuration(String duration) {
        Matcher matcher = DURATION_SEGMENT.matcher(duration);
        long seconds = 0;
        boolean found = false;
        while (matcher.find()) {
            found = true;
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "d" -> seconds += amount * 24 * 60 * 60;
                case "h" -> seconds += amount * 60 * 60;
                case "m" -> seconds += amount * 60;
                case "s" -> seconds += amount;
                default -> throw new SelectorParseException("UnsupportedSelectorDurationType: " + matcher.group(2));
            }
        }
        if (!found || seconds <= 0) {
            throw new SelectorParseException("UnsupportedSelectorDuration: " + duration);
        }
        return seconds;
    }

    static Instant parseStartTime(String startTime) {
        try {
            return LocalDateTime.parse(startTime, START_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new SelectorParseException("UnsupportedSubsetDateFormat: " + startTime, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void validateVersion(JsonNode root) {
        JsonNode version = root.get("file_format_version");
        if (version == null) {
            throw new SelectorParseException("NoSelectorVersionSpecified");
        }
        if (!version.isNumber() || version.asDouble() != SUPPORTED_VERSION) {
            throw new SelectorParseException("UnsupportedSelectorVersion: " + version.asText());
        }
        if (root.has("subsets")) {
            throw new SelectorParseException("SubsetsNoLongerSupported");
        }
    }

    private List<Metric> parseMetrics(JsonNode metricsNode) {
        List<String> names = new ArrayList<>();
        if (metricsNode.isTextual()) {
            names.add(metricsNode.asText());
        } else if (metricsNode.isArray()) {
            metricsNode.forEach(m -> names.add(m.asText()));
        }
        if (names.isEmpty()) {
            throw new SelectorParseException("UnsupportedMetric: no metrics given");
        }
        if (names.contains("all")) {
            return Arrays.asList(Metric.values());
        }

        List<Metric> metrics = new ArrayList<>();
        for (String name : names) {
            try {
                metrics.add(Metric.fromKey(name));
            } catch (TelescopeException e) {
                throw new SelectorParseException(e.getMessage(), e);
            }
        }
        return metrics;
    }

    private IpTranslationSpec parseIpTranslation(JsonNode node) {
        JsonNode strategy = node.get("strategy");
        JsonNode snapshots = node.path("params").get("db_snapshots");
        if (strategy == null || snapshots == null || !snapshots.isArray()) {
            throw new SelectorParseException("Missing expected field in ip_translation: strategy or params.db_snapshots");
        }

        List<LocalDate> dates = new ArrayList<>();
        for (JsonNode snapshot : snapshots) {
            try {
                dates.add(LocalDate.parse(snapshot.asText()));
            } catch (DateTimeParseException e) {
                throw new SelectorParseException("Invalid snapshot date: " + snapshot.asText(), e);
            }
        }
        return new IpTranslationSpec(strategy.asText(), dates);
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new SelectorParseException("Missing required field: " + field);
        }
        return node;
    }

    private static <T> List<T> requiredList(JsonNode root, String field, Function<String, T> parser) {
        List<T> values = optionalList(root, field, parser);
        if (values.size() == 1 && values.get(0) == null) {
            throw new SelectorParseException("Missing required field: " + field);
        }
        return values;
    }

    /**
     * Values of a list field, or a single null when the field is absent so that
     * the cartesian expansion still yields one selector without that filter.
     */
    private static <T> List<T> optionalList(JsonNode root, String field, Function<String, T> parser) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || (node.isArray() && node.isEmpty())) {
            return Collections.singletonList(null);
        }
        if (!node.isArray()) {
            throw new SelectorParseException("Field " + field + " must be a list");
        }
        List<T> values = new ArrayList<>();
        node.forEach(value -> values.add(parser.apply(value.asText())));
        return values;
    }
}
