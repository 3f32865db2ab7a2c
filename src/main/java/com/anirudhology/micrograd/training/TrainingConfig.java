package com.anirudhology.micrograd.training;

import java.util.List;

/**
 * Hyperparameters for training an MLP classifier with SGD.
 *
 * @param hiddenLayerSizes      neurons per layer after the input, the last one is the output
 * @param steps                 number of full-batch optimization steps
 * @param initialLearningRate   learning rate at step 0
 * @param finalLearningRateFraction fraction of the initial rate reached at the last step
 * @param regularization        L2 penalty coefficient (alpha)
 * @param seed                  seed for weight initialization and data generation
 * @param logInterval           log every n steps
 */
public record TrainingConfig(
        List<Integer> hiddenLayerSizes,
        int steps,
        double initialLearningRate,
        double finalLearningRateFraction,
        double regularization,
        long seed,
        int logInterval
) {

    public TrainingConfig {
        hiddenLayerSizes = List.copyOf(hiddenLayerSizes);
        if (hiddenLayerSizes.isEmpty()) {
            throw new IllegalArgumentException("hiddenLayerSizes must not be empty");
        }
        if (steps <= 0) {
            throw new IllegalArgumentException("steps must be positive, got: " + steps);
        }
        if (logInterval <= 0) {
            throw new IllegalArgumentException("logInterval must be positive, got: " + logInterval);
        }
    }

    public static TrainingConfig defaults() {
        return new TrainingConfig(List.of(16, 16, 1), 100, 1.0, 0.1, 1e-4, 42L, 1);
    }

    /**
     * Linear decay from the initial rate towards {@code initial * finalLearningRateFraction}.
     */
    public double learningRate(int step) {
        return this.initialLearningRate * (1.0 - (1.0 - this.finalLearningRateFraction) * step / this.steps);
    }
}
