package com.anirudhology.micrograd.nn;

import com.anirudhology.micrograd.autograd.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Multilayer perceptron.
 * <p>
 * Architecture:
 * Input → Layer (relu) → ... → Layer (relu) → Layer (linear) → scores
 * <p>
 * The last layer stays linear so the output can take any sign.
 */
public class MLP {

    private final List<Layer> layers;

    public MLP(int inputDimension, List<Integer> layerSizes, Random random) {
        if (layerSizes.isEmpty()) {
            throw new IllegalArgumentException("MLP needs at least one layer");
        }
        this.layers = new ArrayList<>(layerSizes.size());

        int previous = inputDimension;
        for (int i = 0; i < layerSizes.size(); i++) {
            boolean last = i == layerSizes.size() - 1;
            this.layers.add(new Layer(previous, layerSizes.get(i), !last, random));
            previous = layerSizes.get(i);
        }
    }

    public List<Value> forward(List<Value> input) {
        List<Value> x = input;
        for (Layer layer : this.layers) {
            x = layer.forward(x);
        }
        return x;
    }

    /**
     * Get all parameters for optimization
     */
    public List<Value> parameters() {
        final List<Value> params = new ArrayList<>();
        for (Layer layer : this.layers) {
            params.addAll(layer.parameters());
        }
        return params;
    }

    /**
     * Gradients accumulate across backward passes, so reset before each one.
     */
    public void zeroGradient() {
        for (Value parameter : parameters()) {
            parameter.zeroGradient();
        }
    }

    public List<Layer> getLayers() {
        return List.copyOf(this.layers);
    }

    @Override
    public String toString() {
        return "MLP" + this.layers;
    }
}
