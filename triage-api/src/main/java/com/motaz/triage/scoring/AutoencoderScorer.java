package com.motaz.triage.scoring;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores rows by mean squared reconstruction error of a frozen autoencoder.
 * Immutable once built, so one instance is shared by all pipeline threads.
 */
@Slf4j
public class AutoencoderScorer {

    private final FeatureCodec codec;
    private final AutoencoderNetwork network;
    @Getter
    private final double threshold;
    @Getter
    private final Double thresholdPercentile;

    public AutoencoderScorer(FeatureCodec codec, AutoencoderNetwork network, double threshold, Double thresholdPercentile) {
        this.codec = codec;
        this.network = network;
        this.threshold = threshold;
        this.thresholdPercentile = thresholdPercentile;
    }

    public FeatureSchema schema() {
        return codec.schema();
    }

    /**
     * Scores the whole table. A schema mismatch anywhere fails the batch
     * before any result is produced.
     */
    public ScoringResult score(TabularData table) {
        int[] binding = codec.bind(table.getHeader());
        FeatureSchema schema = codec.schema();

        List<List<String>> alignedRows = new ArrayList<>(table.rowCount());
        List<double[]> vectors = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> aligned = codec.align(table.getRows().get(r), binding, r);
            alignedRows.add(aligned);
            vectors.add(codec.encode(aligned, r));
        }

        List<RowScore> anomalies = new ArrayList<>();
        for (int r = 0; r < vectors.size(); r++) {
            double[] input = vectors.get(r);
            double[] output = network.reconstruct(input);
            double[] errors = new double[input.length];
            double sum = 0.0;
            for (int f = 0; f < input.length; f++) {
                double diff = input[f] - output[f];
                errors[f] = diff * diff;
                sum += errors[f];
            }
            double score = sum / input.length;
            if (score >= threshold) {
                anomalies.add(new RowScore(r, score, rankFeatures(schema, alignedRows.get(r), input, errors),
                        rawData(table.getHeader(), table.getRows().get(r))));
            }
        }
        log.info("Scored {} rows, {} at or above threshold {}", vectors.size(), anomalies.size(), threshold);
        return new ScoringResult(vectors.size(), threshold, anomalies);
    }

    private static List<FeatureError> rankFeatures(FeatureSchema schema, List<String> cells, double[] encoded, double[] errors) {
        List<FeatureError> features = new ArrayList<>(errors.length);
        for (int f = 0; f < errors.length; f++) {
            features.add(new FeatureError(schema.get(f).getName(), cells.get(f), encoded[f], errors[f]));
        }
        // stable sort keeps schema order among equal errors
        features.sort(Comparator.comparingDouble(FeatureError::getReconstructionError).reversed());
        return features;
    }

    private static Map<String, String> rawData(List<String> header, List<String> row) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            raw.put(header.get(i).trim(), row.get(i));
        }
        return raw;
    }
}
