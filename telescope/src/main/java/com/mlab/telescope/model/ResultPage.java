package com.mlab.telescope.model;

import java.util.List;
import java.util.Map;

/**
 * One page of query results, rows keyed by result column name.
 *
 * @param pageToken token for the next page, null on the last page
 */
public record ResultPage(long totalRows, List<Map<String, String>> rows, String pageToken) {

    public boolean hasNextPage() {
        return pageToken != null && !pageToken.isEmpty();
    }
}
