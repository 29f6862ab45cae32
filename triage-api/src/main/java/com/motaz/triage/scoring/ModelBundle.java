package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Serialized form of a trained autoencoder together with its preprocessing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelBundle {
    private String version;
    private List<FeatureSpec> features;
    private List<LayerSpec> layers;
    private double threshold;
    private Double thresholdPercentile;
}
