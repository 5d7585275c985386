package org.carma.bilateral.safety;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;

/**
 * Validation checks shared by the learners, the mechanisms and the
 * environments. Every check either returns its argument or throws one of
 * the exceptions in this package.
 */
public final class ContractGuard {

    private ContractGuard() {
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    public static int requirePositiveHorizon(int horizon) {
        if (horizon <= 0) {
            throw new InvalidConfigurationException("Horizon T must be positive, got " + horizon);
        }
        return horizon;
    }

    public static int requirePositiveResolution(int resolution) {
        if (resolution <= 0) {
            throw new InvalidConfigurationException("Grid resolution K must be positive, got " + resolution);
        }
        return resolution;
    }

    public static int requireLearnableExpertCount(int size) {
        if (size < 2) {
            throw new InvalidConfigurationException(
                "A learner needs at least 2 experts so that ln(N) > 0, got " + size);
        }
        return size;
    }

    // ========================================================================
    // Environment
    // ========================================================================

    public static int requireRoundInHorizon(int round, int horizon) {
        if (round < 0 || round >= horizon) {
            throw new EnvironmentContractViolationException(round,
                "round index outside [0, " + horizon + ")");
        }
        return round;
    }

    public static Valuations requireValidValuations(int round, Valuations valuations) {
        if (valuations == null) {
            throw new EnvironmentContractViolationException(round, "no valuations returned");
        }
        if (!valuations.isFinite()) {
            throw new EnvironmentContractViolationException(round,
                "non-finite valuations " + valuations);
        }
        return valuations;
    }

    public static PriceBounds requireValidBounds(int round, PriceBounds bounds) {
        if (bounds == null) {
            throw new EnvironmentContractViolationException(round, "no price bounds returned");
        }
        if (!bounds.isWellFormed()) {
            throw new EnvironmentContractViolationException(round,
                String.format("invalid bounds [%s, %s]: lower must be <= upper and both finite",
                    bounds.lower(), bounds.upper()));
        }
        return bounds;
    }

    // ========================================================================
    // Numerics
    // ========================================================================

    public static double requireUsableWeightSum(double sum) {
        if (!(sum > 0) || !Double.isFinite(sum)) {
            throw new NumericDegeneracyException("Learner weights collapsed", sum);
        }
        return sum;
    }
}
