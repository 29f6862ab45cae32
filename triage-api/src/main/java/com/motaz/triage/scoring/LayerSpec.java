package com.motaz.triage.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerSpec {
    private double[][] weights;
    private double[] bias;
    private Activation activation;
}
