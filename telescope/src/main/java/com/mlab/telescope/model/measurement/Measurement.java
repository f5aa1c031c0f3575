package com.mlab.telescope.model.measurement;

import com.mlab.telescope.model.Metric;

/**
 * A single NDT test result, typed for the metric it was retrieved for.
 */
public interface Measurement {

    Metric metric();

    /** Unix timestamp in seconds of the final web100 snapshot. */
    long logTime();

    /** TCP state from the final snapshot, using web100 state codes. */
    int state();

    /** True when the test passes every validity rule for its metric. */
    boolean isValid();

    /**
     * The metric value for this test. Only meaningful for valid measurements;
     * the validity rules keep every denominator non-zero.
     */
    double value();
}
