package com.anirudhology.micrograd.autograd;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * This is a computational graph node that:
 * 1. Stores a number (forward pass)
 * 2. Tracks how it was created (operand nodes + operation)
 * 3. Knows how to push its own gradient to its operands (backward pass)
 * <p>
 * Only four operations carry their own gradient rule: {@link #add(Value)},
 * {@link #multiply(Value)}, {@link #pow(double)} and {@link #relu()}. Everything else
 * (negation, subtraction, division, scalar forms) is built out of those four.
 * <p>
 * Every operation creates a new node that remembers its operands:
 * <p>
 * Value a = new Value(2.0, "a");
 * Value b = new Value(3.0, "b");
 * Value c = a.multiply(b);  // c = a * b = 6.0
 * Value d = c.add(1.0);     // d = c + 1 = 7.0
 * Value e = d.relu();       // e = relu(d) = 7.0
 * <p>
 * Computational Graph:
 * a(2.0)    b(3.0)
 * \        /
 * c = a*b (6.0)
 * |
 * d = c+1 (7.0)
 * |
 * e = relu(d) (7.0)
 * <p>
 * A compound assignment such as {@code x += y} is written {@code x = x.add(y)}: it rebinds
 * {@code x} to a new node and leaves the old one untouched.
 */
public class Value {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    // Stable identity, used to deduplicate nodes reachable through several paths
    private final long id;

    // The actual number (forward value) this node represents.
    private double data;

    // The derivative of the backward root w.r.t this value. Gradient: ∂(root)/∂(this).
    private double gradient;

    // Operand nodes in computation graph (which values were used to create this value).
    // Operand 0 is always the left/base operand.
    private final List<Value> operands;

    // Pushes this node's gradient into its operands' gradients. Null for leaves.
    private Runnable propagate;

    // For debugging: "+", "*", "^", "relu"
    private final String operation;

    // For debugging: "x", "w1", etc.
    private final String label;

    public Value(double data) {
        this(data, List.of(), "", "");
    }

    public Value(double data, String label) {
        this(data, List.of(), "", label);
    }

    private Value(double data, List<Value> operands, String operation, String label) {
        this.id = NEXT_ID.getAndIncrement();
        this.data = data;
        this.gradient = 0.0;
        this.operands = operands;
        this.operation = operation;
        this.label = label;
        this.propagate = null;
    }

    /**
     * Wraps a constant as a leaf node. Handy for constants on the left-hand side,
     * e.g. {@code Value.of(10.0).divide(f)} for 10 / f.
     */
    public static Value of(double data) {
        return new Value(data);
    }

    /**
     * Left fold of {@link #add(Value)} over the given values.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static Value sum(List<Value> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot sum an empty list of values");
        }
        Value total = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            total = total.add(values.get(i));
        }
        return total;
    }

    public long getId() {
        return this.id;
    }

    public double getData() {
        return this.data;
    }

    /**
     * Overwrites the forward value in place. Meant only for parameter updates between
     * training steps; nodes already derived from this one keep their old data.
     */
    public void setData(double data) {
        this.data = data;
    }

    public double getGradient() {
        return this.gradient;
    }

    public void setGradient(double gradient) {
        this.gradient = gradient;
    }

    public void zeroGradient() {
        this.gradient = 0.0;
    }

    /**
     * Operands in operation order. The returned list is immutable.
     */
    public List<Value> getOperands() {
        return this.operands;
    }

    public String getOperation() {
        return this.operation;
    }

    public String getLabel() {
        return this.label;
    }

    public boolean isLeaf() {
        return this.operands.isEmpty();
    }

    public Value add(Value other) {
        Value out = new Value(this.data + other.data, List.of(this, other), "+", "");
        out.propagate = () -> {
            this.gradient += out.gradient; // ∂(out)/∂(this) = 1
            other.gradient += out.gradient; // ∂(out)/∂(other) = 1
        };
        return out;
    }

    public Value add(double c) {
        return add(new Value(c));
    }

    public Value multiply(Value other) {
        Value out = new Value(this.data * other.data, List.of(this, other), "*", "");
        out.propagate = () -> {
            this.gradient += other.data * out.gradient; // ∂(out)/∂(this) = other
            other.gradient += this.data * out.gradient; // ∂(out)/∂(other) = this
        };
        return out;
    }

    public Value multiply(double c) {
        return multiply(new Value(c));
    }

    /**
     * Raises this node to a constant exponent. The exponent is not part of the graph and
     * receives no gradient. A zero base with a negative exponent gives Infinity or NaN.
     */
    public Value pow(double exponent) {
        Value out = new Value(Math.pow(this.data, exponent), List.of(this), "^", "");
        // ∂(out)/∂(this) = n × this^(n-1)
        out.propagate = () -> this.gradient += exponent * Math.pow(this.data, exponent - 1.0) * out.gradient;
        return out;
    }

    public Value relu() {
        Value out = new Value(Math.max(0.0, this.data), List.of(this), "relu", "");
        // ∂(out)/∂(this) = 1 if this > 0, else 0 (also 0 at exactly 0)
        out.propagate = () -> this.gradient += (this.data > 0.0 ? 1.0 : 0.0) * out.gradient;
        return out;
    }

    public Value neg() {
        return this.multiply(-1.0);
    }

    public Value subtract(Value other) {
        return this.add(other.neg());
    }

    public Value subtract(double c) {
        return subtract(new Value(c));
    }

    public Value divide(Value other) {
        return this.multiply(other.pow(-1.0));
    }

    public Value divide(double c) {
        return divide(new Value(c));
    }

    /**
     * Computes ∂(this)/∂(node) for every node reachable from here.
     * <p>
     * Gradients are accumulated, not reset: running this twice without zeroing doubles
     * every non-root gradient. Callers reset gradients between passes.
     *
     * @see Backpropagation#backward(Value)
     */
    public void backward() {
        Backpropagation.backward(this);
    }

    void setRootGradient() {
        this.gradient = 1.0;
    }

    void runPropagate() {
        if (this.propagate != null) {
            this.propagate.run();
        }
    }

    @Override
    public String toString() {
        return "Value(data=" + data + ", grad=" + gradient + ", operation=" + operation + ", label=" + label + ")";
    }
}
