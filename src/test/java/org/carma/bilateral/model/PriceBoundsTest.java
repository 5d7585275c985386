package org.carma.bilateral.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the per-round price envelope and its rescaling transform.
 */
class PriceBoundsTest {

    private static final double EPS = 1e-12;

    @Test
    void shouldRescaleInfeasibleActionIntoEnvelope() {
        // Given: bounds [0.4, 0.6] and an action far outside them
        PriceBounds bounds = new PriceBounds(0.4, 0.6);
        Expert action = new Expert(0.1, 0.9);

        // When
        Expert rescaled = bounds.rescale(action);

        // Then: f = 0.04, ask' = 0.4 + 0.1 * f, bid' = 0.6 - (1 - 0.9) * f
        assertThat(bounds.admits(action)).isFalse();
        assertThat(bounds.rescalingFactor()).isCloseTo(0.04, within(EPS));
        assertThat(rescaled.ask()).isCloseTo(0.404, within(EPS));
        assertThat(rescaled.bid()).isCloseTo(0.596, within(EPS));
        assertThat(bounds.admits(rescaled)).isTrue();
    }

    @Test
    void shouldKeepRescaledActionsInsideAnyOrderedBounds() {
        List<PriceBounds> envelopes = List.of(
            new PriceBounds(0.0, 1.0),
            new PriceBounds(0.4, 0.6),
            new PriceBounds(0.5, 0.5),
            new PriceBounds(-0.3, 1.7),
            new PriceBounds(0.9, 2.5));

        for (PriceBounds bounds : envelopes) {
            for (int a = 0; a <= 20; a++) {
                for (int b = 0; b <= 20; b++) {
                    Expert rescaled = bounds.rescale(new Expert(a / 20.0, b / 20.0));
                    assertThat(rescaled.ask()).isGreaterThanOrEqualTo(bounds.lower());
                    assertThat(rescaled.bid()).isLessThanOrEqualTo(bounds.upper());
                }
            }
        }
    }

    @Test
    void shouldPreserveGridOrderingWhenRescaling() {
        PriceBounds bounds = new PriceBounds(0.2, 0.7);

        Expert low = bounds.rescale(new Expert(0.1, 0.3));
        Expert high = bounds.rescale(new Expert(0.6, 0.8));

        assertThat(low.ask()).isLessThan(high.ask());
        assertThat(low.bid()).isLessThan(high.bid());
    }

    @Test
    void shouldAdmitActionsOnTheBoundary() {
        PriceBounds bounds = new PriceBounds(0.4, 0.6);

        assertThat(bounds.admits(new Expert(0.4, 0.6))).isTrue();
        assertThat(bounds.admits(new Expert(0.39, 0.5))).isFalse();
        assertThat(bounds.admits(new Expert(0.5, 0.61))).isFalse();
    }

    @Test
    void shouldRejectInvertedOrNonFiniteBounds() {
        assertThat(new PriceBounds(0.6, 0.4).isWellFormed()).isFalse();
        assertThat(new PriceBounds(Double.NaN, 0.4).isWellFormed()).isFalse();
        assertThat(new PriceBounds(0.2, Double.POSITIVE_INFINITY).isWellFormed()).isFalse();
        assertThat(new PriceBounds(-1.0, 2.0).isWellFormed()).isTrue();
    }
}
