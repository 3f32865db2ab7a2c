package com.anirudhology.micrograd.training;

import com.anirudhology.micrograd.autograd.Value;
import com.anirudhology.micrograd.data.MoonsDataset;
import com.anirudhology.micrograd.nn.MLP;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Full-batch training loop: forward, zero gradients, backward, SGD update.
 */
public class Trainer {

    private static final Logger LOG = LoggerFactory.getLogger(Trainer.class);

    private final TrainingConfig config;
    private final MaxMarginLoss lossFunction;
    private final SgdOptimizer optimizer;

    public Trainer(TrainingConfig config) {
        this(config, new MaxMarginLoss(config.regularization()), new SgdOptimizer());
    }

    public Trainer(TrainingConfig config, MaxMarginLoss lossFunction, SgdOptimizer optimizer) {
        this.config = config;
        this.lossFunction = lossFunction;
        this.optimizer = optimizer;
    }

    public TrainingHistory train(MLP model, MoonsDataset dataset) {
        final List<Value> parameters = model.parameters();
        final TrainingHistory history = new TrainingHistory();
        LOG.info("Training {} parameters on {} samples for {} steps",
                parameters.size(), dataset.size(), this.config.steps());

        for (int step = 0; step < this.config.steps(); step++) {
            // Forward
            final LossResult result = this.lossFunction.evaluate(model, dataset);
            final Value loss = result.loss();

            // Backward. Gradients accumulate, so must reset first.
            this.optimizer.zeroGradient(parameters);
            loss.backward();

            // Update (SGD)
            final double learningRate = this.config.learningRate(step);
            this.optimizer.step(parameters, learningRate);

            history.record(loss.getData(), result.accuracy());
            if (LOG.isInfoEnabled() && (step % this.config.logInterval() == 0 || step == this.config.steps() - 1)) {
                LOG.info("step {} loss {} accuracy {}%", step,
                        String.format("%.3f", loss.getData()),
                        String.format("%.2f", result.accuracy() * 100.0));
            }
        }
        return history;
    }
}
