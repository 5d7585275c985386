package org.carma.bilateral.mechanism;

import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.model.Expert;
import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.safety.ContractGuard;

/**
 * Keeps posted prices inside the environment's per-round bounds.
 *
 * An action with ask below the lower bound or bid above the upper bound is
 * replaced by {@link PriceBounds#rescale(Expert)}; the learners are then
 * told to evaluate every expert under the same transform.
 */
public class RescalingPolicy implements ActionPolicy {

    @Override
    public Decision decide(Expert rawAction, int round, Environment environment) {
        PriceBounds bounds = ContractGuard.requireValidBounds(round, environment.getConstraints(round));
        if (bounds.admits(rawAction)) {
            return Decision.direct(rawAction);
        }
        return Decision.rescaled(bounds.rescale(rawAction), bounds);
    }
}
