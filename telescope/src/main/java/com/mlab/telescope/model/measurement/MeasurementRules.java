package com.mlab.telescope.model.measurement;

/**
 * Thresholds that decide whether an NDT test is usable.
 *
 * State codes follow http://www.web100.org/download/kernel/tcp-kis.txt.
 * Durations are in microseconds, as recorded by web100.
 */
public final class MeasurementRules {

    /** Tests are meant to last 10 seconds; allow ones ending slightly early. */
    public static final long MIN_DURATION_MICROS = 9_000_000L;

    /** Tests lasting an hour or more are almost certainly broken. */
    public static final long MAX_DURATION_MICROS = 3_600_000_000L;

    /** 6 packets. */
    public static final long MIN_BYTES = 8192L;

    public static final int STATE_CLOSED = 1;
    public static final int STATE_ESTABLISHED = 5;
    public static final int STATE_TIME_WAIT = 11;

    public static final long MIN_RTT_SAMPLES = 10L;

    private MeasurementRules() {
    }

    /** The connection finished the three-way handshake (and possibly closed). */
    public static boolean completedHandshake(int state) {
        return state == STATE_CLOSED || (state >= STATE_ESTABLISHED && state <= STATE_TIME_WAIT);
    }

    public static boolean withinTestDuration(long durationMicros) {
        return durationMicros >= MIN_DURATION_MICROS && durationMicros < MAX_DURATION_MICROS;
    }

    public static boolean enoughBytes(long bytes) {
        return bytes >= MIN_BYTES;
    }

    public static double throughput(double bytes, long timeMicros) {
        return (bytes / (double) timeMicros) * 8;
    }
}
