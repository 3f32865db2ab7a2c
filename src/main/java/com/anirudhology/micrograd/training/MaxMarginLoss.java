package com.anirudhology.micrograd.training;

import com.anirudhology.micrograd.autograd.Value;
import com.anirudhology.micrograd.data.MoonsDataset;
import com.anirudhology.micrograd.nn.MLP;

import java.util.ArrayList;
import java.util.List;

/**
 * SVM "max-margin" loss with L2 regularization:
 * <p>
 * loss = mean(relu(1 - yᵢ * scoreᵢ)) + alpha * Σ p²
 * <p>
 * A sample contributes nothing once it sits on the right side with margin at least 1.
 */
public class MaxMarginLoss {

    private final double regularization;

    public MaxMarginLoss(double regularization) {
        this.regularization = regularization;
    }

    public LossResult evaluate(MLP model, MoonsDataset dataset) {
        final List<List<Value>> inputs = dataset.inputs();
        final double[] labels = dataset.labels();
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute loss on an empty dataset");
        }

        // Forward the model to get scores
        final List<Value> scores = new ArrayList<>(inputs.size());
        for (List<Value> input : inputs) {
            scores.add(model.forward(input).get(0));
        }

        final List<Value> losses = new ArrayList<>(scores.size());
        int correct = 0;
        for (int i = 0; i < scores.size(); i++) {
            Value score = scores.get(i);
            losses.add(score.multiply(-labels[i]).add(1.0).relu());
            if ((labels[i] > 0.0) == (score.getData() > 0.0)) {
                correct++;
            }
        }
        final Value dataLoss = Value.sum(losses).divide(losses.size());

        final List<Value> squares = new ArrayList<>();
        for (Value parameter : model.parameters()) {
            squares.add(parameter.multiply(parameter));
        }
        final Value regularizationLoss = Value.sum(squares).multiply(this.regularization);

        return new LossResult(dataLoss.add(regularizationLoss), (double) correct / scores.size());
    }
}
