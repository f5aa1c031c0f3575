package com.mlab.telescope.model;

import java.time.LocalDate;
import java.util.List;

/**
 * How client provider names are translated to IP blocks.
 *
 * @param strategyName only "maxmind" is supported
 * @param snapshotDates dates of the ASN snapshots to load
 */
public record IpTranslationSpec(String strategyName, List<LocalDate> snapshotDates) {

    public IpTranslationSpec {
        snapshotDates = List.copyOf(snapshotDates);
    }
}
