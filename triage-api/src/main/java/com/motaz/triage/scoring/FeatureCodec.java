package com.motaz.triage.scoring;

import com.motaz.triage.exception.SchemaMismatchException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw table cells into standardized feature vectors using the frozen
 * schema. Any disagreement between the table and the schema is a
 * {@link SchemaMismatchException}; values are never coerced.
 */
public class FeatureCodec {

    static final String MISSING_CATEGORY = "MISSING";
    static final int UNSEEN_CATEGORY = -1;

    private final FeatureSchema schema;

    public FeatureCodec(FeatureSchema schema) {
        this.schema = schema;
    }

    public FeatureSchema schema() {
        return schema;
    }

    /**
     * Maps the table header onto schema order.
     *
     * @return for each schema position, the index of the matching header column
     */
    public int[] bind(List<String> header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i) == null ? "" : header.get(i).trim();
            if (positions.put(column, i) != null) {
                throw new SchemaMismatchException("Duplicate column '" + column + "' in header");
            }
        }
        Set<String> missing = new LinkedHashSet<>();
        int[] binding = new int[schema.size()];
        for (int f = 0; f < schema.size(); f++) {
            Integer position = positions.remove(schema.get(f).getName());
            if (position == null) {
                missing.add(schema.get(f).getName());
            } else {
                binding[f] = position;
            }
        }
        if (!missing.isEmpty() || !positions.isEmpty()) {
            throw new SchemaMismatchException("Header does not match model features: missing " + missing
                    + ", unexpected " + positions.keySet());
        }
        return binding;
    }

    /** Cells of a row in schema order. */
    public List<String> align(List<String> row, int[] binding, int rowIndex) {
        if (row.size() != binding.length) {
            throw new SchemaMismatchException("Row " + rowIndex + " has " + row.size()
                    + " cells, expected " + binding.length);
        }
        List<String> aligned = new ArrayList<>(binding.length);
        for (int position : binding) {
            aligned.add(row.get(position));
        }
        return aligned;
    }

    public double[] encode(List<String> alignedCells, int rowIndex) {
        double[] vector = new double[schema.size()];
        for (int f = 0; f < schema.size(); f++) {
            FeatureSpec spec = schema.get(f);
            double raw = spec.getType() == FeatureType.CATEGORICAL
                    ? categoryIndex(spec, alignedCells.get(f))
                    : numericValue(spec, alignedCells.get(f), rowIndex);
            vector[f] = (raw - spec.getMean()) / spec.getScale();
        }
        return vector;
    }

    private double numericValue(FeatureSpec spec, String cell, int rowIndex) {
        if (cell == null || cell.isBlank()) {
            return spec.getImputeValue();
        }
        double value;
        try {
            value = Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException("Row " + rowIndex + ": column '" + spec.getName()
                    + "' expects a number but got '" + cell + "'");
        }
        if (!Double.isFinite(value)) {
            throw new SchemaMismatchException("Row " + rowIndex + ": column '" + spec.getName()
                    + "' has non-finite value '" + cell + "'");
        }
        return value;
    }

    private double categoryIndex(FeatureSpec spec, String cell) {
        String value = cell == null || cell.isBlank() ? MISSING_CATEGORY : cell.trim();
        List<String> categories = spec.getCategories() == null ? List.of() : spec.getCategories();
        int index = categories.indexOf(value);
        return index >= 0 ? index : UNSEEN_CATEGORY;
    }
}
