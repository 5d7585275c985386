package org.carma.bilateral.learner;

import org.carma.bilateral.model.BestExpert;
import org.carma.bilateral.model.Expert;
import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.ContractGuard;
import org.carma.bilateral.safety.InvalidConfigurationException;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * Multiplicative-weights ("Hedge") learner over a fixed set of price pairs.
 *
 * With N experts and horizon T the learning rate is
 * {@code epsilon = sqrt(ln(N) / T)}. Each round every expert is charged the
 * loss it would have incurred against the revealed valuations and its weight
 * is multiplied by {@code exp(-epsilon * loss)}. Weights are never
 * renormalized; probabilities are always computed as weight / sum.
 *
 * Loss of expert e with potential = buy - sell:
 * <pre>
 *   potential &gt;= 0 : 0 if e clears, otherwise potential (forgone surplus)
 *   potential &lt;  0 : potential if e clears, otherwise 0
 * </pre>
 *
 * Alongside the weights the learner accumulates, per expert, the gains from
 * trade that expert would have realized, for hindsight comparisons.
 *
 * Not thread-safe. Updates must be applied in round order.
 */
public class HedgeLearner {

    private final List<Expert> experts;
    private final int horizon;
    private final double epsilon;
    private final double[] weights;
    private final double[] cumulativeGft;
    private final Random random;
    private long updateCount;

    public HedgeLearner(List<Expert> experts, int horizon, Random random) {
        if (experts == null) {
            throw new InvalidConfigurationException("Expert set must not be null");
        }
        if (random == null) {
            throw new InvalidConfigurationException("Random source must not be null");
        }
        int size = ContractGuard.requireLearnableExpertCount(experts.size());
        this.horizon = ContractGuard.requirePositiveHorizon(horizon);
        this.experts = List.copyOf(experts);
        this.random = random;
        this.epsilon = Math.sqrt(Math.log(size) / horizon);
        this.weights = new double[size];
        this.cumulativeGft = new double[size];
        Arrays.fill(weights, 1.0 / size);
    }

    public HedgeLearner(List<Expert> experts, int horizon) {
        this(experts, horizon, new Random());
    }

    // ========================================================================
    // Action Selection
    // ========================================================================

    /**
     * Sample an expert with probability proportional to its current weight.
     * Does not modify the weights.
     */
    public Expert chooseAction() {
        return experts.get(chooseIndex());
    }

    /**
     * Sample an expert index with probability proportional to its weight.
     */
    public int chooseIndex() {
        double sum = ContractGuard.requireUsableWeightSum(weightSum());
        double target = random.nextDouble() * sum;
        double cumulative = 0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (target < cumulative) {
                return i;
            }
        }
        // Rounding can leave target just above the running sum
        for (int i = weights.length - 1; i >= 0; i--) {
            if (weights[i] > 0) {
                return i;
            }
        }
        return weights.length - 1;
    }

    // ========================================================================
    // Weight Updates
    // ========================================================================

    /**
     * Update every expert against the round's valuations using its raw prices.
     */
    public void updateWeights(double hiddenSell, double hiddenBuy) {
        applyFeedback(new Valuations(hiddenSell, hiddenBuy), UnaryOperator.identity());
    }

    /**
     * Update every expert as if its prices had first been rescaled into
     * [sDot, bDot], the same transform applied to a rescaled chosen action.
     */
    public void updateWeightsWithRescaling(double hiddenSell, double hiddenBuy, double sDot, double bDot) {
        PriceBounds bounds = new PriceBounds(sDot, bDot);
        applyFeedback(new Valuations(hiddenSell, hiddenBuy), bounds::rescale);
    }

    private void applyFeedback(Valuations valuations, UnaryOperator<Expert> pricing) {
        double potential = valuations.potentialGft();
        for (int i = 0; i < weights.length; i++) {
            boolean clears = pricing.apply(experts.get(i)).clearsAgainst(valuations);
            double realized = clears ? potential : 0.0;
            double loss;
            if (potential >= 0) {
                loss = clears ? 0.0 : potential;
            } else {
                loss = realized;
            }
            weights[i] *= Math.exp(-epsilon * loss);
            cumulativeGft[i] += realized;
        }
        updateCount++;
        ContractGuard.requireUsableWeightSum(weightSum());
    }

    // ========================================================================
    // Hindsight
    // ========================================================================

    /**
     * The expert with the largest cumulative realized gains from trade.
     * Ties go to the lowest index.
     */
    public BestExpert bestExpertSoFar() {
        int best = 0;
        for (int i = 1; i < cumulativeGft.length; i++) {
            if (cumulativeGft[i] > cumulativeGft[best]) {
                best = i;
            }
        }
        return new BestExpert(best, experts.get(best), cumulativeGft[best]);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int size() {
        return experts.size();
    }

    public int horizon() {
        return horizon;
    }

    public double epsilon() {
        return epsilon;
    }

    public List<Expert> experts() {
        return experts;
    }

    public Expert expert(int index) {
        return experts.get(index);
    }

    public double weight(int index) {
        return weights[index];
    }

    public double cumulativeGft(int index) {
        return cumulativeGft[index];
    }

    public long updateCount() {
        return updateCount;
    }

    /**
     * Current sampling distribution. Returns a fresh array.
     */
    public double[] probabilities() {
        double sum = ContractGuard.requireUsableWeightSum(weightSum());
        double[] probabilities = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            probabilities[i] = weights[i] / sum;
        }
        return probabilities;
    }

    private double weightSum() {
        double sum = 0;
        for (double w : weights) {
            sum += w;
        }
        return sum;
    }

    @Override
    public String toString() {
        return String.format("HedgeLearner[experts=%d, T=%d, epsilon=%.5f, updates=%d]",
            experts.size(), horizon, epsilon, updateCount);
    }
}
