package com.mlab.telescope.model;

import com.mlab.telescope.exception.UnsupportedMetricException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static com.mlab.telescope.model.WarehouseFields.*;

/**
 * NDT metrics Telescope can retrieve, with the warehouse fields each one needs.
 */
public enum Metric {
    DOWNLOAD_THROUGHPUT("download_throughput", DataDirection.SERVER_TO_CLIENT, List.of()),
    UPLOAD_THROUGHPUT("upload_throughput", DataDirection.CLIENT_TO_SERVER, List.of()),
    MINIMUM_RTT("minimum_rtt", DataDirection.SERVER_TO_CLIENT, List.of(MIN_RTT, COUNT_RTT)),
    AVERAGE_RTT("average_rtt", DataDirection.SERVER_TO_CLIENT, List.of(SUM_RTT, COUNT_RTT)),
    PACKET_RETRANSMIT_RATE("packet_retransmit_rate", DataDirection.SERVER_TO_CLIENT,
            List.of(SEGS_RETRANS, DATA_SEGS_OUT));

    private final String key;
    private final DataDirection direction;
    private final List<String> requiredFields;

    Metric(String key, DataDirection direction, List<String> extraFields) {
        this.key = key;
        this.direction = direction;

        TreeSet<String> fields = new TreeSet<>(COMMON);
        fields.addAll(direction == DataDirection.SERVER_TO_CLIENT ? SERVER_TO_CLIENT : CLIENT_TO_SERVER);
        fields.addAll(extraFields);
        this.requiredFields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static Metric fromKey(String key) {
        return Arrays.stream(values())
                .filter(m -> m.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new UnsupportedMetricException(key));
    }

    public String getKey() {
        return key;
    }

    public DataDirection getDirection() {
        return direction;
    }

    /** Sorted, de-duplicated list of dotted field names this metric selects. */
    public List<String> getRequiredFields() {
        return requiredFields;
    }

    public boolean isServerToClient() {
        return direction == DataDirection.SERVER_TO_CLIENT;
    }

    public boolean isRoundTripTime() {
        return this == MINIMUM_RTT || this == AVERAGE_RTT;
    }

    @Override
    public String toString() {
        return key;
    }
}
