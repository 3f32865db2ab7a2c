package com.anirudhology.micrograd.nn;

import com.anirudhology.micrograd.autograd.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Single neuron: out = relu(w · x + b), or just w · x + b when linear.
 */
public class Neuron {

    private final Value[] weights;
    private final Value bias;
    private final boolean nonlinear;

    public Neuron(int inputDimension, boolean nonlinear, Random random) {
        if (inputDimension <= 0) {
            throw new IllegalArgumentException("inputDimension must be positive, got: " + inputDimension);
        }
        this.weights = new Value[inputDimension];
        this.nonlinear = nonlinear;

        // Uniform initialization in [-1, 1)
        for (int i = 0; i < inputDimension; i++) {
            this.weights[i] = new Value(random.nextDouble() * 2.0 - 1.0);
        }
        this.bias = new Value(0.0);
    }

    /**
     * Forward pass: sum = x₀*w₀ + x₁*w₁ + ... + b
     *
     * @param input Input vector (length: inputDimension)
     * @return activation of this neuron
     */
    public Value forward(List<Value> input) {
        if (input.size() != this.weights.length) {
            throw new IllegalArgumentException(String.format("Expected input size %d, got %d", this.weights.length, input.size()));
        }

        Value sum = this.weights[0].multiply(input.get(0));
        for (int i = 1; i < this.weights.length; i++) {
            sum = sum.add(this.weights[i].multiply(input.get(i)));
        }
        sum = sum.add(this.bias);

        return this.nonlinear ? sum.relu() : sum;
    }

    /**
     * Bias first, then weights in input order.
     */
    public List<Value> parameters() {
        final List<Value> params = new ArrayList<>(this.weights.length + 1);
        params.add(this.bias);
        for (Value weight : this.weights) {
            params.add(weight);
        }
        return params;
    }

    public int getInputDimension() {
        return this.weights.length;
    }

    public boolean isNonlinear() {
        return this.nonlinear;
    }

    @Override
    public String toString() {
        return (this.nonlinear ? "ReLU" : "Linear") + "Neuron(" + this.weights.length + ")";
    }
}
