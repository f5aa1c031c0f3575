package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

/**
 * Client-to-server test. These do not maintain CongSignals.
 */
public record UploadMeasurement(long logTime, int state, long octetsReceived, long duration)
        implements Measurement {

    @Override
    public Metric metric() {
        return Metric.UPLOAD_THROUGHPUT;
    }

    @Override
    public boolean isValid() {
        return MeasurementRules.withinTestDuration(duration)
                && MeasurementRules.enoughBytes(octetsReceived)
                && MeasurementRules.completedHandshake(state);
    }

    @Override
    public double value() {
        return MeasurementRules.throughput(octetsReceived, duration);
    }
}
