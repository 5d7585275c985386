package org.carma.bilateral.model;

/**
 * Per-round feasible price envelope supplied by a constrained environment.
 *
 * An action is admissible when its ask is at least {@code lower} and its bid
 * at most {@code upper}. Bounds may lie outside [0,1].
 */
public record PriceBounds(double lower, double upper) {

    public boolean admits(Expert action) {
        return action.ask() >= lower && action.bid() <= upper;
    }

    /**
     * Width of the envelope squared. Used to compress normalized [0,1]
     * coordinates into the envelope.
     */
    public double rescalingFactor() {
        double width = upper - lower;
        return width * width;
    }

    /**
     * Map a normalized action into this envelope:
     * <pre>
     *   f    = (upper - lower)^2
     *   ask' = lower + ask * f
     *   bid' = upper - (1 - bid) * f
     * </pre>
     * For coordinates in [0,1] the result satisfies {@code ask' >= lower}
     * and {@code bid' <= upper}, and the ordering of the grid is preserved.
     */
    public Expert rescale(Expert action) {
        double factor = rescalingFactor();
        return new Expert(
            lower + action.ask() * factor,
            upper - (1 - action.bid()) * factor);
    }

    public boolean isWellFormed() {
        return Double.isFinite(lower) && Double.isFinite(upper) && lower <= upper;
    }
}
