package com.mlab.telescope.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A fully resolved request for one dataset: one selector becomes one query.
 */
@Value
@Builder(toBuilder = true)
public class Selector {

    /** Start of the window, UTC. */
    Instant startTime;

    /** Window length in seconds. */
    long durationSeconds;

    Metric metric;

    IpTranslationSpec ipTranslationSpec;

    /** Optional ISP short name or AS name fragment, e.g. "comcast". */
    String clientProvider;

    /** Optional ISO country code, stored lower case. */
    String clientCountry;

    /** Optional M-Lab site id, e.g. "lga02". */
    String site;

    public Instant getEndTime() {
        return startTime.plusSeconds(durationSeconds);
    }
}
