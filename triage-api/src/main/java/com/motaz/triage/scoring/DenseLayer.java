package com.motaz.triage.scoring;

import smile.math.MathEx;

/** Fully connected layer, {@code weights[out][in]}. */
public class DenseLayer {

    private final double[][] weights;
    private final double[] bias;
    private final Activation activation;

    public DenseLayer(double[][] weights, double[] bias, Activation activation) {
        this.weights = weights;
        this.bias = bias;
        this.activation = activation;
    }

    public int inputSize() {
        return weights[0].length;
    }

    public int outputSize() {
        return weights.length;
    }

    public double[] forward(double[] input) {
        double[] output = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            output[i] = activation.apply(MathEx.dot(weights[i], input) + bias[i]);
        }
        return output;
    }
}
