package com.mlab.telescope.model;

/**
 * One row of an ASN snapshot: an inclusive IPv4 range owned by an organisation.
 */
public record IpBlock(long start, long end, String asnName) {

    public IpRange range() {
        return new IpRange(start, end);
    }
}
