package org.carma.bilateral.model;

/**
 * Operating phase of a trade mechanism.
 *
 * The mechanism starts in {@link #PROFIT_MAX} and moves to {@link #GFT_MAX}
 * once its budget reaches the threshold. The transition is one-way.
 */
public enum Phase {

    /** Accumulating budget with the profit learner. */
    PROFIT_MAX,

    /** Spending budget to maximize gains from trade with the GFT learner. */
    GFT_MAX;

    public boolean canTransitionTo(Phase next) {
        return this == next || (this == PROFIT_MAX && next == GFT_MAX);
    }
}
