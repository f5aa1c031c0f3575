package com.mlab.telescope.service;

import com.mlab.telescope.model.Metric;
import com.mlab.telescope.model.ResultRow;
import com.mlab.telescope.model.measurement.Measurement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates retrieved measurements and reduces each valid one to a
 * timestamped value.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MeasurementPipeline {

    private final MeasurementMapper mapper;

    /**
     * Map, filter and reduce one job's rows.
     *
     * @throws com.mlab.telescope.exception.MeasurementFormatException if any row is unusable
     */
    public List<ResultRow> process(Metric metric, List<Map<String, String>> rows) {
        List<Measurement> measurements = mapper.map(metric, rows);
        List<Measurement> kept = filter(metric, measurements);
        log.info("Filtered measurements, kept {} and discarded {}.",
                kept.size(), measurements.size() - kept.size());
        return reduce(metric, kept);
    }

    public List<Measurement> filter(Metric metric, List<? extends Measurement> measurements) {
        return measurements.stream()
                .map(m -> checkMetric(metric, m))
                .filter(Measurement::isValid)
                .collect(Collectors.toList());
    }

    /**
     * One result per measurement. Denominators are not checked here; callers
     * must {@link #filter} first.
     */
    public List<ResultRow> reduce(Metric metric, List<? extends Measurement> measurements) {
        return measurements.stream()
                .map(m -> checkMetric(metric, m))
                .map(m -> new ResultRow(m.logTime(), m.value()))
                .collect(Collectors.toList());
    }

    private static Measurement checkMetric(Metric metric, Measurement measurement) {
        if (measurement.metric() != metric) {
            throw new IllegalArgumentException(
                    "Measurement for " + measurement.metric() + " passed to " + metric + " pipeline");
        }
        return measurement;
    }
}
