package com.anirudhology.micrograd.nn;

import com.anirudhology.micrograd.autograd.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fully-connected layer made of independent neurons sharing the same input
 */
public class Layer {

    private final List<Neuron> neurons;

    public Layer(int inputDimension, int outputDimension, boolean nonlinear, Random random) {
        this.neurons = new ArrayList<>(outputDimension);
        for (int j = 0; j < outputDimension; j++) {
            this.neurons.add(new Neuron(inputDimension, nonlinear, random));
        }
    }

    /**
     * @param input Input vector (length: inputDimension)
     * @return Output vector (length: outputDimension)
     */
    public List<Value> forward(List<Value> input) {
        final List<Value> output = new ArrayList<>(this.neurons.size());
        for (Neuron neuron : this.neurons) {
            output.add(neuron.forward(input));
        }
        return output;
    }

    public List<Value> parameters() {
        final List<Value> params = new ArrayList<>();
        for (Neuron neuron : this.neurons) {
            params.addAll(neuron.parameters());
        }
        return params;
    }

    public List<Neuron> getNeurons() {
        return List.copyOf(this.neurons);
    }

    @Override
    public String toString() {
        return "Layer" + this.neurons;
    }
}
