package org.carma.bilateral.simulation;

import org.carma.bilateral.config.SimulationConfigLoader;
import org.carma.bilateral.config.SimulationConfigLoader.SimulationConfig;
import org.carma.bilateral.model.Phase;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end runs from configuration fixtures.
 */
class TradeSimulationTest {

    private final SimulationConfigLoader loader = new SimulationConfigLoader();

    @Test
    void shouldRunConstrainedConstantScenario() throws IOException {
        // Given
        SimulationConfig config = loader.loadResource("constrained-constant.yaml");

        // When
        SimulationResult result = new TradeSimulation(config).run();

        // Then: every posted pair sits in [0.4, 0.6] and therefore clears
        SimulationMetrics metrics = result.metrics();
        assertThat(result.mechanism()).isEqualTo("ConstrainedTradeMechanism");
        assertThat(metrics.getRoundCount()).isEqualTo(100);
        assertThat(metrics.getClearRate()).isEqualTo(1.0);
        assertThat(metrics.getRescaledRounds()).isPositive();
        assertThat(result.finalGft()).isCloseTo(0.4 * 100, within(1e-9));
        assertThat(metrics.getFinalGft()).isEqualTo(result.finalGft());
        assertThat(metrics.getRoundsIn(Phase.PROFIT_MAX) + metrics.getRoundsIn(Phase.GFT_MAX)).isEqualTo(100);
        assertThat(metrics.getPhaseSwitchRound()).isEqualTo(result.phaseSwitchRound());
    }

    @Test
    void shouldReproduceResultsForSameConfig() throws IOException {
        SimulationConfig config = loader.loadResource("uniform-unconstrained.yaml");

        SimulationResult first = new TradeSimulation(config).run();
        SimulationResult second = new TradeSimulation(config).run();

        assertThat(first.finalGft()).isEqualTo(second.finalGft());
        assertThat(first.budget()).isEqualTo(second.budget());
        assertThat(first.regret()).isEqualTo(second.regret());
        assertThat(first.metrics().getGftHistory()).isEqualTo(second.metrics().getGftHistory());
    }

    @Test
    void shouldTrackBudgetAndGftHistories() throws IOException {
        SimulationConfig config = loader.loadResource("uniform-unconstrained.yaml");

        SimulationResult result = new TradeSimulation(config).run();
        SimulationMetrics metrics = result.metrics();

        assertThat(metrics.getBudgetHistory()).hasSize(400);
        assertThat(metrics.getGftHistory()).hasSize(400);
        assertThat(metrics.getFinalBudget()).isEqualTo(result.budget());
        assertThat(metrics.getPeakBudget()).isGreaterThanOrEqualTo(result.budget());
        assertThat(metrics.getRescaledRounds()).isZero();
        assertThat(result.regret())
            .isCloseTo(result.bestFixedExpert().cumulativeGft() - result.finalGft(), within(1e-9));
    }
}
