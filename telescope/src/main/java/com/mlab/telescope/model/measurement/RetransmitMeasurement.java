package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

/**
 * Packet retransmission rate, see
 * https://code.google.com/p/m-lab/wiki/PDEChartsNDT#Packet_retransmission
 */
public record RetransmitMeasurement(long logTime, int state, SenderSnapshot sender, long segsRetrans,
                                    long dataSegsOut) implements Measurement {

    @Override
    public Metric metric() {
        return Metric.PACKET_RETRANSMIT_RATE;
    }

    @Override
    public boolean isValid() {
        return sender.isValid()
                && MeasurementRules.completedHandshake(state)
                && segsRetrans != 0
                && dataSegsOut > 0;
    }

    @Override
    public double value() {
        return (double) segsRetrans / (double) dataSegsOut;
    }
}
