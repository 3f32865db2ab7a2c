package com.anirudhology.micrograd.training;

import com.anirudhology.micrograd.autograd.Value;

import java.util.List;

/**
 * Plain stochastic gradient descent.
 * <p>
 * Update rule:
 * param = param - lr * grad
 */
public class SgdOptimizer {

    /**
     * Perform one update step.
     * <p>
     * Call this after loss.backward() has computed gradients
     */
    public void step(List<Value> parameters, double learningRate) {
        for (Value parameter : parameters) {
            parameter.setData(parameter.getData() - learningRate * parameter.getGradient());
        }
    }

    /**
     * Zero all parameter gradients.
     * Call this before loss.backward()
     */
    public void zeroGradient(List<Value> parameters) {
        for (Value parameter : parameters) {
            parameter.zeroGradient();
        }
    }
}
