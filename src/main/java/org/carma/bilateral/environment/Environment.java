package org.carma.bilateral.environment;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;

/**
 * Source of per-round valuations (and, for constrained mechanisms, price
 * bounds) that a trade mechanism plays against.
 *
 * Implementations must answer every round index in [0, horizon). Bounds
 * must satisfy lower &lt;= upper; values outside [0,1] are allowed.
 */
public interface Environment {

    /**
     * Number of rounds this environment can serve.
     */
    int horizon();

    /**
     * Seller and buyer valuations for the given round.
     */
    Valuations getValuations(int round);

    /**
     * Feasible price envelope for the given round. Environments that do not
     * constrain prices leave this unimplemented.
     */
    default PriceBounds getConstraints(int round) {
        throw new UnsupportedOperationException(
            getClass().getSimpleName() + " does not supply price constraints");
    }
}
