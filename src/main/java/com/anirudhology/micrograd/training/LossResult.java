package com.anirudhology.micrograd.training;

import com.anirudhology.micrograd.autograd.Value;

/**
 * @param loss     root of the loss graph, ready for {@code backward()}
 * @param accuracy fraction of samples on the right side of the decision boundary
 */
public record LossResult(Value loss, double accuracy) {
}
