package com.anirudhology.micrograd.data;

import com.anirudhology.micrograd.autograd.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Two interleaving half circles, the classic toy problem for a binary classifier
 * that needs a nonlinear decision boundary.
 */
public class MoonsDataset {

    private static final Logger LOG = LoggerFactory.getLogger(MoonsDataset.class);

    private final List<DataPoint> points;

    public MoonsDataset(List<DataPoint> points) {
        this.points = List.copyOf(points);
    }

    /**
     * Reads {@code x,y,label} rows. The first line is a header and is skipped.
     */
    public static MoonsDataset readCsv(Path path) {
        final List<String> lines;
        try {
            lines = Files.readAllLines(path);
        } catch (IOException e) {
            LOG.error("Error reading dataset file due to: {}", e.getMessage());
            throw new UncheckedIOException("Failed to read dataset file " + path, e);
        }

        final List<DataPoint> points = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            final String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            points.add(parseRow(line, i + 1));
        }
        LOG.info("Total data points read: {}", points.size());
        return new MoonsDataset(points);
    }

    /**
     * Samples {@code samples} points: the first half on the outer moon (label -1),
     * the rest on the inner moon (label +1), each jittered by gaussian noise.
     */
    public static MoonsDataset generate(int samples, double noise, Random random) {
        if (samples <= 0) {
            throw new IllegalArgumentException("samples must be positive, got: " + samples);
        }
        final int outer = samples / 2;
        final int inner = samples - outer;
        final List<DataPoint> points = new ArrayList<>(samples);

        for (int i = 0; i < outer; i++) {
            double angle = outer == 1 ? 0.0 : Math.PI * i / (outer - 1);
            points.add(new DataPoint(
                    Math.cos(angle) + random.nextGaussian() * noise,
                    Math.sin(angle) + random.nextGaussian() * noise,
                    -1.0));
        }
        for (int i = 0; i < inner; i++) {
            double angle = inner == 1 ? 0.0 : Math.PI * i / (inner - 1);
            points.add(new DataPoint(
                    1.0 - Math.cos(angle) + random.nextGaussian() * noise,
                    0.5 - Math.sin(angle) + random.nextGaussian() * noise,
                    1.0));
        }
        LOG.debug("Generated {} moon samples with noise {}", samples, noise);
        return new MoonsDataset(points);
    }

    private static DataPoint parseRow(String line, int lineNumber) {
        final String[] fields = line.split(",");
        if (fields.length < 3) {
            throw new IllegalArgumentException("Expected 3 columns on line " + lineNumber + ", got " + fields.length);
        }
        final double x;
        final double y;
        final double label;
        try {
            x = Double.parseDouble(fields[0].trim());
            y = Double.parseDouble(fields[1].trim());
            label = Double.parseDouble(fields[2].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed number on line " + lineNumber + ": " + line, e);
        }
        if (label != -1.0 && label != 1.0) {
            throw new IllegalArgumentException("Label must be -1 or 1 on line " + lineNumber + ", got " + label);
        }
        return new DataPoint(x, y, label);
    }

    /**
     * Each point as a fresh pair of leaf nodes, ready to feed into a model.
     */
    public List<List<Value>> inputs() {
        final List<List<Value>> inputs = new ArrayList<>(this.points.size());
        for (DataPoint point : this.points) {
            inputs.add(List.of(new Value(point.x()), new Value(point.y())));
        }
        return inputs;
    }

    public double[] labels() {
        final double[] labels = new double[this.points.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = this.points.get(i).label();
        }
        return labels;
    }

    public List<DataPoint> getPoints() {
        return this.points;
    }

    public int size() {
        return this.points.size();
    }
}
