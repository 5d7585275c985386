package org.carma.bilateral.model;

/**
 * The best fixed price rule in hindsight: its index in the expert set,
 * the price pair, and the gains from trade it would have realized.
 */
public record BestExpert(int index, Expert expert, double cumulativeGft) {

    @Override
    public String toString() {
        return String.format("BestExpert[#%d %s, gft=%.4f]", index, expert, cumulativeGft);
    }
}
