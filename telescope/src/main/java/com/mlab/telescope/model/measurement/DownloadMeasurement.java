package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

public record DownloadMeasurement(long logTime, int state, SenderSnapshot sender) implements Measurement {

    @Override
    public Metric metric() {
        return Metric.DOWNLOAD_THROUGHPUT;
    }

    @Override
    public boolean isValid() {
        return sender.isValid() && MeasurementRules.completedHandshake(state);
    }

    /** Bits per microsecond, i.e. Mbps. */
    @Override
    public double value() {
        return MeasurementRules.throughput(sender.octetsAcked(), sender.sendTime());
    }
}
