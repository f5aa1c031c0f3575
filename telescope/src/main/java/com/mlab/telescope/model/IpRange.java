package com.mlab.telescope.model;

import java.util.Comparator;

/**
 * Inclusive range of IPv4 addresses encoded as integers.
 */
public record IpRange(long start, long end) implements Comparable<IpRange> {

    private static final Comparator<IpRange> ORDER =
            Comparator.comparingLong(IpRange::start).thenComparingLong(IpRange::end);

    @Override
    public int compareTo(IpRange other) {
        return ORDER.compare(this, other);
    }
}
