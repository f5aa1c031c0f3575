package com.mlab.telescope.service;

import com.mlab.telescope.exception.MalformedMeasurementException;
import com.mlab.telescope.exception.MissingFieldException;
import com.mlab.telescope.model.Metric;
import com.mlab.telescope.model.measurement.AverageRttMeasurement;
import com.mlab.telescope.model.measurement.DownloadMeasurement;
import com.mlab.telescope.model.measurement.Measurement;
import com.mlab.telescope.model.measurement.MinimumRttMeasurement;
import com.mlab.telescope.model.measurement.RetransmitMeasurement;
import com.mlab.telescope.model.measurement.SenderSnapshot;
import com.mlab.telescope.model.measurement.UploadMeasurement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.mlab.telescope.model.WarehouseFields.*;

/**
 * Turns raw result rows into typed measurements for the metric they were
 * queried for.
 *
 * One bad row fails the whole batch: a row without a field the query selected
 * means the response as a whole cannot be trusted.
 */
@Component
public class MeasurementMapper {

    public List<Measurement> map(Metric metric, List<Map<String, String>> rows) {
        List<Measurement> measurements = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            measurements.add(map(metric, row));
        }
        return measurements;
    }

    public Measurement map(Metric metric, Map<String, String> row) {
        long direction = integer(row, DATA_DIRECTION);
        if (direction != metric.getDirection().getCode()) {
            throw new MalformedMeasurementException(
                    "Row with data direction " + direction + " returned for " + metric);
        }

        long logTime = integer(row, LOG_TIME);
        int state = (int) integer(row, STATE);

        return switch (metric) {
            case DOWNLOAD_THROUGHPUT -> new DownloadMeasurement(logTime, state, sender(row));
            case UPLOAD_THROUGHPUT -> new UploadMeasurement(logTime, state,
                    integer(row, OCTETS_RECEIVED), integer(row, DURATION));
            case MINIMUM_RTT -> new MinimumRttMeasurement(logTime, state, sender(row),
                    integer(row, MIN_RTT), integer(row, COUNT_RTT));
            case AVERAGE_RTT -> new AverageRttMeasurement(logTime, state, sender(row),
                    integer(row, SUM_RTT), integer(row, COUNT_RTT));
            case PACKET_RETRANSMIT_RATE -> new RetransmitMeasurement(logTime, state, sender(row),
                    integer(row, SEGS_RETRANS), integer(row, DATA_SEGS_OUT));
        };
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private SenderSnapshot sender(Map<String, String> row) {
        return new SenderSnapshot(
                integer(row, OCTETS_ACKED),
                integer(row, SND_LIM_TIME_RWIN),
                integer(row, SND_LIM_TIME_CWND),
                integer(row, SND_LIM_TIME_SND),
                integer(row, CONG_SIGNALS));
    }

    private long integer(Map<String, String> row, String field) {
        String column = resultColumn(field);
        String value = row.get(column);
        if (value == null) {
            throw new MissingFieldException(column);
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedMeasurementException("Non-integer value '" + value + "' for " + column, e);
        }
    }
}
