package com.mlab.telescope.service;

import com.mlab.telescope.exception.SnapshotUnavailableException;
import com.mlab.telescope.model.IpBlock;
import com.mlab.telescope.model.IpRange;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates client provider names to IP blocks using a MaxMind GeoIPASNum2
 * snapshot held in memory.
 *
 * Snapshot rows are {@code block_start,block_end,"AS name"}. Provider names
 * are matched case-insensitively against the AS name; a handful of ISP short
 * names expand to every organisation the ISP trades under.
 *
 * Lookups are cached per provider name for the lifetime of the translator,
 * which is safe because the snapshot never changes after load.
 */
@Slf4j
public class AsnBlockTranslator {

    private static final DateTimeFormatter SNAPSHOT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final Map<String, List<String>> SHORT_NAMES = Map.of(
            "twc", List.of("Time Warner"),
            "centurylink", List.of("Qwest", "Embarq", "Centurylink", "Centurytel"),
            "level3", List.of("Level 3 Communications", "GBLX"),
            "cablevision", List.of("Cablevision Systems", "CSC Holdings", "Cablevision Infrastructure",
                    "Cablevision Corporate", "Optimum Online", "Optimum WiFi", "Optimum Network"));

    private final List<IpBlock> blocks;
    private final Map<String, List<IpRange>> cache = new ConcurrentHashMap<>();

    public AsnBlockTranslator(List<IpBlock> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    /**
     * Load the snapshot taken on {@code snapshotDate} from {@code directory}.
     *
     * @throws SnapshotUnavailableException if the snapshot file cannot be read
     */
    public static AsnBlockTranslator load(LocalDate snapshotDate, Path directory) {
        Path snapshotPath = snapshotPath(snapshotDate, directory);
        try (Reader reader = Files.newBufferedReader(snapshotPath, StandardCharsets.ISO_8859_1)) {
            List<IpBlock> blocks = parse(reader);
            log.debug("Parsed {} blocks from ASN snapshot {}", blocks.size(), snapshotPath);
            return new AsnBlockTranslator(blocks);
        } catch (IOException | CsvException | NumberFormatException e) {
            throw new SnapshotUnavailableException(snapshotPath, e);
        }
    }

    public static Path snapshotPath(LocalDate snapshotDate, Path directory) {
        return directory.resolve("GeoIPASNum2-" + snapshotDate.format(SNAPSHOT_DATE) + ".csv");
    }

    static List<IpBlock> parse(Reader reader) throws IOException, CsvException {
        List<IpBlock> blocks = new ArrayList<>();
        try (CSVReader csv = new CSVReader(reader)) {
            for (String[] row : csv.readAll()) {
                if (row.length < 3 || row[0].isBlank()) continue;
                blocks.add(new IpBlock(
                        Long.parseLong(row[0].trim()),
                        Long.parseLong(row[1].trim()),
                        row[2]));
            }
        }
        return blocks;
    }

    /**
     * All blocks whose AS name matches {@code providerName}, in snapshot order.
     * Returns an empty list when nothing matches.
     */
    public List<IpRange> findBlocks(String providerName) {
        return cache.computeIfAbsent(providerName, this::scan);
    }

    public int size() {
        return blocks.size();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<IpRange> scan(String providerName) {
        Pattern pattern = Pattern.compile(searchExpression(providerName), Pattern.CASE_INSENSITIVE);
        Set<String> reported = new HashSet<>();
        List<IpRange> matches = new ArrayList<>();

        for (IpBlock block : blocks) {
            if (!pattern.matcher(block.asnName()).find()) continue;

            if (reported.add(block.asnName())) {
                log.debug("Found IP block associated with name {} searching for term {}.",
                        block.asnName(), providerName);
            }
            matches.add(block.range());
        }
        return Collections.unmodifiableList(matches);
    }

    /**
     * Regex matching every organisation behind a provider name, e.g. "level3"
     * becomes {@code (\QLevel 3 Communications\E)|(\QGBLX\E)}. Names without an
     * alias match literally.
     */
    static String searchExpression(String providerName) {
        List<String> names = SHORT_NAMES.get(providerName.toLowerCase(Locale.ROOT));
        if (names == null) {
            return Pattern.quote(providerName);
        }
        return names.stream()
                .map(name -> "(" + Pattern.quote(name) + ")")
                .collect(Collectors.joining("|"));
    }
}
