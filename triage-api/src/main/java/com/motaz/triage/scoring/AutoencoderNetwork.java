package com.motaz.triage.scoring;

import java.util.List;

public class AutoencoderNetwork {

    private final List<DenseLayer> layers;

    public AutoencoderNetwork(List<DenseLayer> layers) {
        this.layers = List.copyOf(layers);
    }

    public double[] reconstruct(double[] input) {
        double[] activations = input;
        for (DenseLayer layer : layers) {
            activations = layer.forward(activations);
        }
        return activations;
    }

    public int depth() {
        return layers.size();
    }
}
