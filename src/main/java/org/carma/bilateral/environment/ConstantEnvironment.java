package org.carma.bilateral.environment;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.ContractGuard;

/**
 * Serves the same valuations, and optionally the same bounds, every round.
 */
public class ConstantEnvironment implements Environment {

    private final int horizon;
    private final Valuations valuations;
    private final PriceBounds bounds;

    public ConstantEnvironment(int horizon, Valuations valuations) {
        this(horizon, valuations, null);
    }

    public ConstantEnvironment(int horizon, Valuations valuations, PriceBounds bounds) {
        this.horizon = ContractGuard.requirePositiveHorizon(horizon);
        this.valuations = valuations;
        this.bounds = bounds;
    }

    @Override
    public int horizon() {
        return horizon;
    }

    @Override
    public Valuations getValuations(int round) {
        ContractGuard.requireRoundInHorizon(round, horizon);
        return valuations;
    }

    @Override
    public PriceBounds getConstraints(int round) {
        if (bounds == null) {
            return Environment.super.getConstraints(round);
        }
        ContractGuard.requireRoundInHorizon(round, horizon);
        return bounds;
    }

    @Override
    public String toString() {
        return String.format("ConstantEnvironment[T=%d, %s, %s]", horizon, valuations, bounds);
    }
}
