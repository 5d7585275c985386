package org.carma.bilateral.environment;

import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.EnvironmentContractViolationException;
import org.carma.bilateral.safety.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the bundled environments.
 */
class EnvironmentTest {

    @Test
    void shouldReplayRecordedRounds() {
        ReplayEnvironment replay = new ReplayEnvironment(
            List.of(new Valuations(0.1, 0.9), new Valuations(0.6, 0.4)),
            List.of(new PriceBounds(0.2, 0.8), new PriceBounds(0.3, 0.5)));

        assertThat(replay.horizon()).isEqualTo(2);
        assertThat(replay.isConstrained()).isTrue();
        assertThat(replay.getValuations(1)).isEqualTo(new Valuations(0.6, 0.4));
        assertThat(replay.getConstraints(0)).isEqualTo(new PriceBounds(0.2, 0.8));
    }

    @Test
    void shouldRejectRoundsOutsideReplay() {
        ReplayEnvironment replay = new ReplayEnvironment(List.of(new Valuations(0.1, 0.9)));

        EnvironmentContractViolationException error =
            catchThrowableOfType(() -> replay.getValuations(1), EnvironmentContractViolationException.class);
        assertThat(error).isNotNull();
        assertThat(error.getRound()).isEqualTo(1);
        assertThatThrownBy(() -> replay.getValuations(-1))
            .isInstanceOf(EnvironmentContractViolationException.class);
    }

    @Test
    void shouldNotSupplyBoundsWhenUnconstrained() {
        ReplayEnvironment replay = new ReplayEnvironment(List.of(new Valuations(0.1, 0.9)));

        assertThatThrownBy(() -> replay.getConstraints(0))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> new ConstantEnvironment(5, new Valuations(0.1, 0.9)).getConstraints(0))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectMismatchedReplayLengths() {
        assertThatThrownBy(() -> new ReplayEnvironment(
                List.of(new Valuations(0.1, 0.9), new Valuations(0.2, 0.8)),
                List.of(new PriceBounds(0.0, 1.0))))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new ReplayEnvironment(List.of()))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void shouldDrawStableUniformValuationsFromSeed() {
        StochasticEnvironment first = new StochasticEnvironment(200, 31L, 0.3);
        StochasticEnvironment second = new StochasticEnvironment(200, 31L, 0.3);

        for (int i = 0; i < 200; i++) {
            Valuations v = first.getValuations(i);
            assertThat(v).isEqualTo(second.getValuations(i));
            assertThat(v).isEqualTo(first.getValuations(i));
            assertThat(v.sell()).isBetween(0.0, 1.0);
            assertThat(v.buy()).isBetween(0.0, 1.0);

            PriceBounds bounds = first.getConstraints(i);
            assertThat(bounds.upper() - bounds.lower()).isCloseTo(0.3, within(1e-12));
            assertThat(bounds.lower()).isGreaterThanOrEqualTo(0.0);
            assertThat(bounds.upper()).isLessThanOrEqualTo(1.0 + 1e-12);
        }
    }

    @Test
    void shouldRejectInvalidBoundWidth() {
        assertThatThrownBy(() -> new StochasticEnvironment(10, 1L, 1.5))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new StochasticEnvironment(0, 1L))
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
