package com.mlab.telescope.model.measurement;

/**
 * Server side counters shared by every server-to-client metric.
 */
public record SenderSnapshot(long octetsAcked,
                             long sndLimTimeRwin,
                             long sndLimTimeCwnd,
                             long sndLimTimeSnd,
                             long congSignals) {

    /** Microseconds the sender spent sending, summed over all limit states. */
    public long sendTime() {
        return sndLimTimeRwin + sndLimTimeCwnd + sndLimTimeSnd;
    }

    /**
     * Lasted a plausible test duration, acked enough bytes and left slow start
     * (hit congestion at least once).
     */
    public boolean isValid() {
        return MeasurementRules.withinTestDuration(sendTime())
                && MeasurementRules.enoughBytes(octetsAcked)
                && congSignals > 0;
    }
}
