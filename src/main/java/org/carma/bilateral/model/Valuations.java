package org.carma.bilateral.model;

/**
 * Private valuations revealed after a round's prices have been posted.
 */
public record Valuations(double sell, double buy) {

    /** Total surplus available this round (may be negative). */
    public double potentialGft() {
        return buy - sell;
    }

    public boolean isFinite() {
        return Double.isFinite(sell) && Double.isFinite(buy);
    }
}
