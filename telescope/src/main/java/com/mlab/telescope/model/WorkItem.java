package com.mlab.telescope.model;

import lombok.Value;
import lombok.With;

import java.nio.file.Path;

/**
 * Scheduler queue entry: one compiled query waiting to run, or waiting to run again.
 */
@Value
public class WorkItem {

    CompiledQuery query;

    QueryMetadata metadata;

    Path outputPath;

    @With
    boolean retry;

    public static WorkItem of(CompiledQuery query, QueryMetadata metadata, Path outputPath) {
        return new WorkItem(query, metadata, outputPath, false);
    }
}
