package org.carma.bilateral.mechanism;

import org.carma.bilateral.environment.Environment;

import java.util.Random;

/**
 * Trade mechanism that must keep posted prices inside per-round bounds
 * supplied by the environment.
 *
 * Each round the bounds are fetched after the action is chosen. An action
 * outside them is rescaled before posting, and every learner updated that
 * round evaluates its whole grid under the same rescaling.
 *
 * @see RescalingPolicy
 */
public class ConstrainedTradeMechanism extends TradeMechanism {

    public ConstrainedTradeMechanism(int horizon, Environment environment) {
        this(horizon, environment, new Random());
    }

    public ConstrainedTradeMechanism(int horizon, Environment environment, Random random) {
        super(horizon, environment, random, new RescalingPolicy());
    }
}
