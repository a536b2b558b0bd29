package org.karo.test.utils;

import org.karo.runtime.model.ParticleView;
import org.karo.runtime.spi.IRandomProvider;
import org.karo.runtime.spi.IStepRule;
import org.karo.runtime.spi.StepContext;
import org.karo.runtime.spi.StepDecision;

import com.typesafe.config.Config;

/**
 * Unbiased random walk. In asynchronous mode waiting times are exponentially
 * distributed with the configured rate. Counts its own steps in trait state.
 */
public class RandomWalkRule implements IStepRule {

    private final double rate;

    public RandomWalkRule() {
        this(1.0);
    }

    public RandomWalkRule(double rate) {
        this.rate = rate;
    }

    public RandomWalkRule(Config options) {
        this(options.hasPath("rate") ? options.getDouble("rate") : 1.0);
    }

    @Override
    public StepDecision step(StepContext context) {
        IRandomProvider random = context.getRandom();
        context.getState().set("steps", context.getState().getInt("steps", 0) + 1);
        int direction = random.nextInt(2) == 0 ? -1 : 1;
        return StepDecision.move(direction).after(waitingTime(random));
    }

    @Override
    public double initialDelay(ParticleView particle, IRandomProvider random) {
        return waitingTime(random);
    }

    private double waitingTime(IRandomProvider random) {
        return -Math.log(1.0 - random.nextDouble()) / rate;
    }
}
