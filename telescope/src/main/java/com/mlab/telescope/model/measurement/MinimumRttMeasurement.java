package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

public record MinimumRttMeasurement(long logTime, int state, SenderSnapshot sender, long minRtt, long countRtt)
        implements Measurement {

    @Override
    public Metric metric() {
        return Metric.MINIMUM_RTT;
    }

    @Override
    public boolean isValid() {
        return sender.isValid()
                && MeasurementRules.completedHandshake(state)
                && minRtt != 0
                && countRtt >= MeasurementRules.MIN_RTT_SAMPLES;
    }

    @Override
    public double value() {
        return (double) minRtt;
    }
}
