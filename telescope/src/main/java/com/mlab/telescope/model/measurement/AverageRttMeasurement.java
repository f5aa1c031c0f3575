package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

public record AverageRttMeasurement(long logTime, int state, SenderSnapshot sender, long sumRtt, long countRtt)
        implements Measurement {

    @Override
    public Metric metric() {
        return Metric.AVERAGE_RTT;
    }

    @Override
    public boolean isValid() {
        return sender.isValid()
                && MeasurementRules.completedHandshake(state)
                && sumRtt != 0
                && countRtt >= MeasurementRules.MIN_RTT_SAMPLES;
    }

    @Override
    public double value() {
        return (double) sumRtt / (double) countRtt;
    }
}
