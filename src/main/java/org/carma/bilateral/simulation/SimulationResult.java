package org.carma.bilateral.simulation;

import org.carma.bilateral.model.BestExpert;
import org.carma.bilateral.model.Phase;

/**
 * Outcome of one simulated run.
 */
public record SimulationResult(
        String name,
        String mechanism,
        int horizon,
        double finalGft,
        double budget,
        Phase finalPhase,
        int phaseSwitchRound,
        BestExpert bestFixedExpert,
        double regret,
        SimulationMetrics metrics
) {

    @Override
    public String toString() {
        return String.format(
            "SimulationResult[%s/%s, T=%d, gft=%.4f, budget=%.4f, phase=%s, switch=%d, best=%.4f, regret=%.4f]",
            name, mechanism, horizon, finalGft, budget, finalPhase, phaseSwitchRound,
            bestFixedExpert.cumulativeGft(), regret);
    }
}
