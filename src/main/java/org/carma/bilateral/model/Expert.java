package org.carma.bilateral.model;

/**
 * A candidate posted-price rule: the ask paid to the seller and the bid
 * charged to the buyer, both in normalized price units.
 *
 * Experts are identified by their position in an expert set, not by value,
 * so two equal pairs at different indices are different experts.
 */
public record Expert(double ask, double bid) {

    /**
     * Whether this price pair clears against the round's valuations:
     * the seller accepts the ask and the buyer accepts the bid.
     */
    public boolean clearsAgainst(Valuations valuations) {
        return valuations.sell() <= ask && bid <= valuations.buy();
    }

    /**
     * Surplus retained by the mechanism when this pair clears (bid - ask).
     * Negative when the mechanism subsidizes the trade.
     */
    public double spread() {
        return bid - ask;
    }

    @Override
    public String toString() {
        return String.format("Expert[ask=%.4f, bid=%.4f]", ask, bid);
    }
}
