package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** Header plus data rows of a parsed dataset, cells kept as text. */
@Getter
@AllArgsConstructor
public class TabularData {
    private final List<String> header;
    private final List<List<String>> rows;

    public int rowCount() {
        return rows.size();
    }
}
