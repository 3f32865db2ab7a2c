package com.anirudhology.micrograd.autograd;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reverse-mode differentiation over a graph of {@link Value} nodes.
 * <p>
 * A node's propagation rule reads its own accumulated gradient, so it may only run once
 * every consumer of that node has already pushed its contribution. Walking the reverse
 * of a depth-first postorder gives exactly that: consumers before the operands they
 * were derived from, the root first and the leaves last.
 */
public final class Backpropagation {

    private Backpropagation() {
    }

    /**
     * Implements multivariate chain rule
     * <p>
     * 1. Builds topological order
     * 2. Initializes root gradient to 1.0 (∂root/∂root)
     * 3. Runs every propagation rule in reverse topological order
     */
    public static void backward(Value root) {
        final List<Value> topology = topologicalOrder(root);

        root.setRootGradient();
        for (int i = topology.size() - 1; i >= 0; i--) {
            topology.get(i).runPropagate();
        }
    }

    /**
     * Orders every node reachable from {@code root} so that each node comes after all of
     * its operands. Each node appears once, however many paths lead to it, and
     * {@code root} is last.
     */
    public static List<Value> topologicalOrder(Value root) {
        final List<Value> topology = new ArrayList<>();
        final Set<Long> visited = new HashSet<>();

        // Explicit stack instead of recursion, so graph depth is not bounded by the call stack
        final Deque<Frame> stack = new ArrayDeque<>();
        visited.add(root.getId());
        stack.push(new Frame(root));

        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            final List<Value> operands = frame.value.getOperands();
            if (frame.nextOperand < operands.size()) {
                final Value operand = operands.get(frame.nextOperand++);
                if (visited.add(operand.getId())) {
                    stack.push(new Frame(operand));
                }
            } else {
                // All operands emitted, so this node can follow them
                stack.pop();
                topology.add(frame.value);
            }
        }
        return topology;
    }

    /**
     * A node on the traversal stack and the index of the next operand to visit.
     */
    private static final class Frame {

        private final Value value;
        private int nextOperand;

        private Frame(Value value) {
            this.value = value;
            this.nextOperand = 0;
        }
    }
}
