package com.motaz.triage.scoring;

public enum Activation {
    RELU {
        @Override
        public double apply(double x) {
            return Math.max(0.0, x);
        }
    },
    LINEAR {
        @Override
        public double apply(double x) {
            return x;
        }
    },
    SIGMOID {
        @Override
        public double apply(double x) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
    },
    TANH {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }
    };

    public abstract double apply(double x);
}
