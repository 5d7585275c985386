package org.carma.bilateral.environment;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.ContractGuard;
import org.carma.bilateral.safety.InvalidConfigurationException;

import java.util.List;

/**
 * Replays a recorded sequence of valuations and, optionally, price bounds.
 */
public class ReplayEnvironment implements Environment {

    private final List<Valuations> valuations;
    private final List<PriceBounds> bounds;

    public ReplayEnvironment(List<Valuations> valuations) {
        this(valuations, null);
    }

    /**
     * @param valuations one entry per round
     * @param bounds one entry per round, or null for an unconstrained replay
     */
    public ReplayEnvironment(List<Valuations> valuations, List<PriceBounds> bounds) {
        if (valuations == null || valuations.isEmpty()) {
            throw new InvalidConfigurationException("Replay needs at least one round of valuations");
        }
        if (bounds != null && bounds.size() != valuations.size()) {
            throw new InvalidConfigurationException(String.format(
                "Replay has %d valuation rounds but %d bound rounds", valuations.size(), bounds.size()));
        }
        this.valuations = List.copyOf(valuations);
        this.bounds = bounds != null ? List.copyOf(bounds) : null;
    }

    @Override
    public int horizon() {
        return valuations.size();
    }

    @Override
    public Valuations getValuations(int round) {
        ContractGuard.requireRoundInHorizon(round, horizon());
        return valuations.get(round);
    }

    @Override
    public PriceBounds getConstraints(int round) {
        if (bounds == null) {
            return Environment.super.getConstraints(round);
        }
        ContractGuard.requireRoundInHorizon(round, horizon());
        return bounds.get(round);
    }

    public boolean isConstrained() {
        return bounds != null;
    }
}
