package com.mlab.telescope.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Per-run switches handed in from the command line.
 */
@Value
@Builder
public class RunOptions {

    Path outputDir;

    int maxConcurrentJobs;

    /** Compile queries only, submit nothing. */
    boolean dryRun;

    /** Re-run selectors even when a result file already exists. */
    boolean ignoreCache;

    /** Also write each query's text next to its results. */
    boolean saveQuery;

    /** Directory holding the ASN snapshot files. */
    Path maxmindDir;
}
