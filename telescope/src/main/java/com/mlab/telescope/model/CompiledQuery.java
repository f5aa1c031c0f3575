package com.mlab.telescope.model;

import lombok.Value;

import java.util.List;

/**
 * Query text plus the monthly tables it reads.
 */
@Value
public class CompiledQuery {

    String text;

    List<String> tables;

    public CompiledQuery(String text, List<String> tables) {
        this.text = text;
        this.tables = List.copyOf(tables);
    }

    public int tableSpan() {
        return tables.size();
    }
}
