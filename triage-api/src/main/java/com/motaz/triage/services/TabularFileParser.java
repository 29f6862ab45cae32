package com.motaz.triage.services;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.motaz.triage.exception.SchemaMismatchException;
import com.motaz.triage.scoring.TabularData;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Reads a CSV dataset into header and rows. Cells are kept as text for the feature codec. */
@Component
public class TabularFileParser {

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public TabularData parse(byte[] content) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).readValues(content)) {
            while (iterator.hasNextValue()) {
                lines.add(iterator.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new SchemaMismatchException("Dataset is not valid CSV: " + e.getMessage());
        }
        if (lines.isEmpty()) {
            throw new SchemaMismatchException("Dataset has no header row");
        }
        List<String> header = new ArrayList<>(Arrays.asList(lines.get(0)));
        if (!header.isEmpty() && header.get(0) != null && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }
        List<List<String>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            rows.add(Arrays.asList(lines.get(i)));
        }
        return new TabularData(header, rows);
    }
}
