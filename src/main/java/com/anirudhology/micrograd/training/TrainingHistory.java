package com.anirudhology.micrograd.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loss and accuracy recorded at every step, measured before that step's update.
 */
public class TrainingHistory {

    private final List<Double> losses = new ArrayList<>();
    private final List<Double> accuracies = new ArrayList<>();

    void record(double loss, double accuracy) {
        this.losses.add(loss);
        this.accuracies.add(accuracy);
    }

    public List<Double> getLosses() {
        return Collections.unmodifiableList(this.losses);
    }

    public List<Double> getAccuracies() {
        return Collections.unmodifiableList(this.accuracies);
    }

    public int size() {
        return this.losses.size();
    }

    public double finalLoss() {
        if (this.losses.isEmpty()) {
            throw new IllegalStateException("No steps recorded");
        }
        return this.losses.get(this.losses.size() - 1);
    }

    public double finalAccuracy() {
        if (this.accuracies.isEmpty()) {
            throw new IllegalStateException("No steps recorded");
        }
        return this.accuracies.get(this.accuracies.size() - 1);
    }
}
