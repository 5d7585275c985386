package org.carma.bilateral.model;

/**
 * What happened in a single round of a trade mechanism.
 *
 * @param round round index
 * @param phase phase that played the round
 * @param rawAction price pair proposed by the active learner
 * @param committedAction price pair actually posted (rescaled if needed)
 * @param valuations valuations revealed for the round
 * @param rescaled whether the raw action was rescaled into the bounds
 * @param cleared whether the committed action cleared
 * @param budgetAfter mechanism budget after the round
 * @param gftAfter accumulated gains from trade after the round
 */
public record RoundOutcome(
        int round,
        Phase phase,
        Expert rawAction,
        Expert committedAction,
        Valuations valuations,
        boolean rescaled,
        boolean cleared,
        double budgetAfter,
        double gftAfter
) {

    /** Budget change contributed by this round. */
    public double budgetDelta() {
        return cleared ? committedAction.spread() : 0.0;
    }

    /** Gains from trade realized in this round. */
    public double gftDelta() {
        return cleared ? valuations.potentialGft() : 0.0;
    }
}
