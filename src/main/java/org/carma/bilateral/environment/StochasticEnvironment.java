package org.carma.bilateral.environment;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.ContractGuard;
import org.carma.bilateral.safety.InvalidConfigurationException;

import java.util.Random;

/**
 * I.i.d. uniform valuations on [0,1], drawn up front from a seeded source so
 * that repeated queries for a round return the same values.
 *
 * When a bound width w in (0, 1] is given, each round also gets an envelope
 * [l, l + w] with l uniform on [0, 1 - w].
 */
public class StochasticEnvironment implements Environment {

    private final Valuations[] valuations;
    private final PriceBounds[] bounds;

    public StochasticEnvironment(int horizon, long seed) {
        this(horizon, seed, 0.0);
    }

    /**
     * @param boundWidth width of the per-round envelope, or 0 for no bounds
     */
    public StochasticEnvironment(int horizon, long seed, double boundWidth) {
        ContractGuard.requirePositiveHorizon(horizon);
        if (boundWidth < 0 || boundWidth > 1 || Double.isNaN(boundWidth)) {
            throw new InvalidConfigurationException("Bound width must be in [0, 1], got " + boundWidth);
        }

        Random random = new Random(seed);
        this.valuations = new Valuations[horizon];
        this.bounds = boundWidth > 0 ? new PriceBounds[horizon] : null;

        for (int i = 0; i < horizon; i++) {
            valuations[i] = new Valuations(random.nextDouble(), random.nextDouble());
            if (bounds != null) {
                double lower = random.nextDouble() * (1 - boundWidth);
                bounds[i] = new PriceBounds(lower, lower + boundWidth);
            }
        }
    }

    @Override
    public int horizon() {
        return valuations.length;
    }

    @Override
    public Valuations getValuations(int round) {
        ContractGuard.requireRoundInHorizon(round, horizon());
        return valuations[round];
    }

    @Override
    public PriceBounds getConstraints(int round) {
        if (bounds == null) {
            return Environment.super.getConstraints(round);
        }
        ContractGuard.requireRoundInHorizon(round, horizon());
        return bounds[round];
    }

    public boolean isConstrained() {
        return bounds != null;
    }
}
