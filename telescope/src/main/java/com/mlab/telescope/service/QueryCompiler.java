package com.mlab.telescope.service;

import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.model.CompiledQuery;
import com.mlab.telescope.model.IpRange;
import com.mlab.telescope.model.Metric;
import com.mlab.telescope.model.Selector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.mlab.telescope.model.WarehouseFields.*;
import static com.mlab.telescope.model.measurement.MeasurementRules.*;

/**
 * Compiles a {@link Selector} into legacy SQL over the monthly NDT tables.
 *
 * Output depends only on the inputs: field lists are sorted and server IP and
 * client block lists are de-duplicated and sorted before rendering, so the
 * same request always produces byte-identical text.
 */
@Component
@Slf4j
public class QueryCompiler {

    private static final DateTimeFormatter TABLE_MONTH = DateTimeFormatter.ofPattern("yyyy_MM");

    private static final List<String> ALWAYS_NON_NULL = List.of(DATA_DIRECTION, IS_LAST_ENTRY, REMOTE_IP, LOCAL_IP);

    private final String dataset;

    public QueryCompiler(TelescopeProperties properties) {
        this.dataset = properties.getWarehouse().getDataset();
    }

    /**
     * @param clientBlocks client IP ranges to restrict to, empty for no restriction
     * @param serverIps    server addresses to restrict to, empty for no restriction
     */
    public CompiledQuery compile(Selector selector, Collection<IpRange> clientBlocks, Collection<String> serverIps) {
        if (selector.getDurationSeconds() <= 0) {
            throw new IllegalArgumentException("Selector duration must be positive: " + selector.getDurationSeconds());
        }
        Metric metric = selector.getMetric();
        List<String> tables = tablesCovering(selector.getStartTime(), selector.getEndTime());

        List<String> conditions = new ArrayList<>();
        conditions.addAll(nonNullConditions(metric));
        conditions.add("project = 0");
        conditions.add(IS_LAST_ENTRY + " = True");
        conditions.add(DATA_DIRECTION + " = " + metric.getDirection().getCode());
        conditions.addAll(validityConditions(metric));
        conditions.add(logTimeCondition(selector.getStartTime(), selector.getEndTime()));

        if (serverIps != null && !serverIps.isEmpty()) {
            conditions.add(serverIpCondition(serverIps));
        }
        if (clientBlocks != null && !clientBlocks.isEmpty()) {
            conditions.add(clientBlockCondition(clientBlocks));
        }
        if (selector.getClientCountry() != null) {
            conditions.add(CLIENT_COUNTRY + " = '" + selector.getClientCountry().toUpperCase(Locale.ROOT) + "'");
        }

        String text = "SELECT\n\t" + String.join(",\n\t", metric.getRequiredFields())
                + "\nFROM\n\t" + String.join(",\n\t", tables)
                + "\nWHERE\n\t" + String.join("\n\tAND ", conditions);

        return new CompiledQuery(text, tables);
    }

    /**
     * One table per calendar month touched by {@code [start, end)}: the start is
     * rounded down to its month and the last covered instant up to its month.
     */
    List<String> tablesCovering(Instant start, Instant end) {
        YearMonth first = YearMonth.from(start.atZone(ZoneOffset.UTC));
        YearMonth last = YearMonth.from(end.minusSeconds(1).atZone(ZoneOffset.UTC));

        List<String> tables = new ArrayList<>();
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            tables.add("[" + dataset + "." + month.format(TABLE_MONTH) + ".all]");
        }
        return tables;
    }

    // ── Clauses ──────────────────────────────────────────────────────────────

    private List<String> nonNullConditions(Metric metric) {
        SortedSet<String> fields = new TreeSet<>(ALWAYS_NON_NULL);
        fields.addAll(metric.getRequiredFields());
        return fields.stream()
                .map(field -> field + " IS NOT NULL")
                .collect(Collectors.toList());
    }

    private List<String> validityConditions(Metric metric) {
        List<String> conditions = new ArrayList<>();
        // Must have completed the TCP three-way handshake.
        conditions.add("(" + STATE + " = " + STATE_CLOSED
                + "\n\t\tOR (" + STATE + " >= " + STATE_ESTABLISHED
                + "\n\t\t\tAND " + STATE + " <= " + STATE_TIME_WAIT + "))");

        if (metric.isServerToClient()) {
            String sendTime = "(" + SND_LIM_TIME_RWIN + " +\n\t\t" + SND_LIM_TIME_CWND
                    + " +\n\t\t" + SND_LIM_TIME_SND + ")";
            // Must have left slow start, i.e. reached congestion at least once.
            conditions.add(CONG_SIGNALS + " > 0");
            conditions.add(OCTETS_ACKED + " >= " + MIN_BYTES);
            conditions.add(sendTime + " >= " + MIN_DURATION_MICROS);
            conditions.add(sendTime + " < " + MAX_DURATION_MICROS);
        } else {
            conditions.add(OCTETS_RECEIVED + " >= " + MIN_BYTES);
            conditions.add(DURATION + " >= " + MIN_DURATION_MICROS);
            conditions.add(DURATION + " < " + MAX_DURATION_MICROS);
        }

        if (metric.isRoundTripTime()) {
            conditions.add(COUNT_RTT + " >= " + MIN_RTT_SAMPLES);
        }
        return conditions;
    }

    private String logTimeCondition(Instant start, Instant end) {
        return "((" + LOG_TIME + " >= " + start.getEpochSecond() + ")"
                + " AND (" + LOG_TIME + " < " + end.getEpochSecond() + "))";
    }

    private String serverIpCondition(Collection<String> serverIps) {
        SortedSet<String> unique = new TreeSet<>(serverIps);
        if (unique.size() != serverIps.size()) {
            log.warn("Server IPs contained duplicates.");
        }
        return unique.stream()
                .map(ip -> LOCAL_IP + " = '" + ip + "'")
                .collect(Collectors.joining(" OR\n\t\t", "(", ")"));
    }

    private String clientBlockCondition(Collection<IpRange> clientBlocks) {
        SortedSet<IpRange> unique = new TreeSet<>(clientBlocks);
        if (unique.size() != clientBlocks.size()) {
            log.warn("Client IP blocks contained duplicates.");
        }
        return unique.stream()
                .map(block -> "PARSE_IP(" + REMOTE_IP + ") BETWEEN " + block.start() + " AND " + block.end())
                .collect(Collectors.joining(" OR\n\t\t", "(", ")"));
    }
}
