package com.anirudhology.micrograd;

import com.anirudhology.micrograd.autograd.Value;
import com.anirudhology.micrograd.data.MoonsDataset;
import com.anirudhology.micrograd.nn.MLP;
import com.anirudhology.micrograd.training.Trainer;
import com.anirudhology.micrograd.training.TrainingConfig;
import com.anirudhology.micrograd.training.TrainingHistory;
import com.anirudhology.micrograd.viz.DecisionBoundaryPlot;
import com.anirudhology.micrograd.viz.GraphvizExporter;

import java.nio.file.Path;
import java.util.Random;

/**
 * Walks through the engine from a single expression up to a trained classifier.
 * <p>
 * Step 1: Expression   - forward pass and gradients of a small expression
 * Step 2: Graph        - the same kind of graph, exported as Graphviz DOT
 * Step 3: Training     - MLP on the moons dataset, SGD with max-margin loss
 * Step 4: Boundary     - ASCII plot of what the trained MLP learned
 * <p>
 * Usage: {@code Runner [moons.csv]}. Without a path a dataset is generated.
 */
public class Runner {

    public static void main(String[] args) {
        printStep(1, "Expression",
                "Build an expression out of Values, run it forward, then backward.");
        runExpression();

        printStep(2, "Graph",
                "((a + b) * (c + d))^2 as Graphviz DOT, after backward.");
        runGraph();

        final TrainingConfig config = TrainingConfig.defaults();
        final Random random = new Random(config.seed());
        final MoonsDataset dataset = args.length > 0
                ? MoonsDataset.readCsv(Path.of(args[0]))
                : MoonsDataset.generate(100, 0.1, random);

        printStep(3, "Training",
                "MLP " + config.hiddenLayerSizes() + " on " + dataset.size() + " moons samples.\n" +
                "  Max-margin loss + L2, SGD with linearly decaying learning rate.");
        final MLP model = new MLP(2, config.hiddenLayerSizes(), random);
        final TrainingHistory history = new Trainer(config).train(model, dataset);
        System.out.printf("Final loss: %.4f | accuracy: %.2f%%%n", history.finalLoss(), history.finalAccuracy() * 100.0);

        printStep(4, "Decision boundary", "'*' is a positive score, '.' a negative one.");
        System.out.print(DecisionBoundaryPlot.render(model, 20, 2.0));
    }

    // -------------------------------------------------------------------------
    // Step 1: Expression
    // -------------------------------------------------------------------------

    private static void runExpression() {
        Value a = new Value(-4.0, "a");
        Value b = new Value(2.0, "b");
        Value c = a.add(b);
        Value d = a.multiply(b).add(b.pow(3));
        c = c.add(c.add(1));
        c = c.add(Value.of(1).add(c).add(a.neg()));
        d = d.add(d.multiply(2)).add(b.add(a).relu());
        d = d.add(Value.of(3).multiply(d)).add(b.subtract(a).relu());
        Value e = c.subtract(d);
        Value f = e.pow(2);
        Value g = f.divide(2.0);
        g = g.add(Value.of(10.0).divide(f));

        System.out.printf("g     = %.4f%n", g.getData());
        g.backward();
        System.out.printf("dg/da = %.4f%n", a.getGradient());
        System.out.printf("dg/db = %.4f%n", b.getGradient());
    }

    // -------------------------------------------------------------------------
    // Step 2: Graph
    // -------------------------------------------------------------------------

    private static void runGraph() {
        Value a = new Value(1.0, "a");
        Value b = new Value(2.0, "b");
        Value c = new Value(3.0, "c");
        Value d = new Value(4.0, "d");

        Value g = a.add(b).multiply(c.add(d)).pow(2);
        g.backward();
        System.out.print(GraphvizExporter.toDot(g));
    }

    // -------------------------------------------------------------------------
    // Utility
    // -------------------------------------------------------------------------

    private static void printStep(int step, String title, String description) {
        System.out.println("\n" + "=".repeat(70));
        System.out.printf("  Step %d: %s%n", step, title);
        System.out.println("=".repeat(70));
        System.out.println("  " + description);
        System.out.println("-".repeat(70));
    }
}
