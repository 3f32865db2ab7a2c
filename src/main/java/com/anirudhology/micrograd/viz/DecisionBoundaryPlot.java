package com.anirudhology.micrograd.viz;

import com.anirudhology.micrograd.autograd.Value;
import com.anirudhology.micrograd.nn.MLP;

import java.util.List;

/**
 * ASCII contour of a 2D binary classifier: '*' where the score is positive, '.' elsewhere.
 */
public final class DecisionBoundaryPlot {

    private DecisionBoundaryPlot() {
    }

    /**
     * Samples a (2 * bound) x (2 * bound) grid. Cell (row, column) maps to the point
     * (column / bound * scale, -row / bound * scale), so the top row is the largest y.
     *
     * @param model classifier with 2 inputs and 1 output
     * @param bound half the grid size in cells
     * @param scale half the plotted extent in input units
     */
    public static String render(MLP model, int bound, double scale) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got: " + bound);
        }
        final StringBuilder sb = new StringBuilder(4 * bound * (2 * bound + 1));
        for (int y = -bound; y < bound; y++) {
            for (int x = -bound; x < bound; x++) {
                final List<Value> input = List.of(
                        new Value((double) x / bound * scale),
                        new Value((double) -y / bound * scale));
                final double score = model.forward(input).get(0).getData();
                sb.append(score > 0.0 ? '*' : '.');
                if (x < bound - 1) {
                    sb.append(' ');
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
