package com.anirudhology.micrograd.data;

/**
 * One labelled 2D sample
 *
 * @param x     first coordinate
 * @param y     second coordinate
 * @param label class, either -1.0 or +1.0
 */
public record DataPoint(double x, double y, double label) {

    public DataPoint {
        if (label != -1.0 && label != 1.0) {
            throw new IllegalArgumentException("Label must be -1 or 1, got " + label);
        }
    }
}
