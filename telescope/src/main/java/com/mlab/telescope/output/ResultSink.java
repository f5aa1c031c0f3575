package com.mlab.telescope.output;

import com.mlab.telescope.model.ResultRow;

import java.nio.file.Path;
import java.util.List;

/**
 * Destination for reduced result rows.
 */
public interface ResultSink {

    /**
     * @return false if the rows could not be persisted
     */
    boolean write(Path outputPath, List<ResultRow> rows);
}
