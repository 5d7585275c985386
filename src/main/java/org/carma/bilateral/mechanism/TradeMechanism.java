package org.carma.bilateral.mechanism;

import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.event.Event;
import org.carma.bilateral.event.EventBus;
import org.carma.bilateral.learner.HedgeLearner;
import org.carma.bilateral.learner.PriceGrid;
import org.carma.bilateral.model.*;
import org.carma.bilateral.safety.ContractGuard;
import org.carma.bilateral.safety.InvalidConfigurationException;

import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Posted-price mechanism for repeated bilateral trade, driven by two hedge
 * learners.
 *
 * <h2>Phases</h2>
 * <ul>
 *   <li>{@link Phase#PROFIT_MAX}: a learner over the multiplicative grid
 *       posts prices with bid &gt;= ask and accumulates budget.</li>
 *   <li>{@link Phase#GFT_MAX}: once the budget reaches sqrt(T), a learner
 *       over the additive grid posts subsidized prices (ask &gt; bid) to
 *       maximize gains from trade. The profit learner keeps receiving
 *       feedback so its hindsight bookkeeping stays complete.</li>
 * </ul>
 *
 * Both grids use resolution K = floor(sqrt(T)). The transition happens at
 * most once and never reverts.
 *
 * An {@link ActionPolicy} decides what is actually posted each round; the
 * default posts the learner's action unchanged.
 *
 * One instance serves exactly one run and is not thread-safe.
 */
public class TradeMechanism {

    private final int horizon;
    private final int resolution;
    private final double budgetThreshold;
    private final Environment environment;
    private final ActionPolicy policy;
    private final HedgeLearner profitLearner;
    private final HedgeLearner gftLearner;

    private double budget;
    private double gft;
    private Phase phase;
    private int roundsPlayed;
    private int phaseSwitchRound;
    private boolean started;

    private EventBus eventBus;
    private boolean verbose;

    public TradeMechanism(int horizon, Environment environment) {
        this(horizon, environment, new Random());
    }

    public TradeMechanism(int horizon, Environment environment, Random random) {
        this(horizon, environment, random, ActionPolicy.unconstrained());
    }

    public TradeMechanism(int horizon, Environment environment, Random random, ActionPolicy policy) {
        this.horizon = ContractGuard.requirePositiveHorizon(horizon);
        if (environment == null) {
            throw new InvalidConfigurationException("Environment must not be null");
        }
        if (environment.horizon() < horizon) {
            throw new InvalidConfigurationException(String.format(
                "Environment serves %d rounds but the mechanism needs %d", environment.horizon(), horizon));
        }
        if (policy == null) {
            throw new InvalidConfigurationException("Action policy must not be null");
        }
        this.environment = environment;
        this.policy = policy;
        this.resolution = (int) Math.floor(Math.sqrt(horizon));
        this.budgetThreshold = Math.sqrt(horizon);

        this.profitLearner = new HedgeLearner(PriceGrid.multiplicativeGrid(resolution), horizon, random);
        this.gftLearner = new HedgeLearner(PriceGrid.additiveGrid(resolution), horizon, random);

        this.budget = 0.0;
        this.gft = 0.0;
        this.phase = Phase.PROFIT_MAX;
        this.phaseSwitchRound = -1;
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    public TradeMechanism setEventBus(EventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public TradeMechanism setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // Execution
    // ========================================================================

    /**
     * Play all T rounds, dispatching each to the step of the phase current
     * at the start of that round.
     */
    public void run() {
        if (started) {
            throw new IllegalStateException("A mechanism instance runs exactly once");
        }
        started = true;

        log("Running %s: T=%d, K=%d, threshold=%.4f, |F|=%d, |H|=%d",
            getClass().getSimpleName(), horizon, resolution, budgetThreshold,
            profitLearner.size(), gftLearner.size());

        for (int i = 0; i < horizon; i++) {
            step(i);
        }

        log("Run complete: gft=%.4f, budget=%.4f, phase=%s, switched at round %d",
            gft, budget, phase, phaseSwitchRound);
        publish(new Event.RunCompletedEvent(Instant.now(), roundsPlayed, phase, budget, gft));
    }

    /**
     * Play round {@code round} in the current phase.
     */
    public RoundOutcome step(int round) {
        ContractGuard.requireRoundInHorizon(round, horizon);
        return phase == Phase.PROFIT_MAX ? profitMaxStep(round) : gftMaxStep(round);
    }

    /**
     * Budget-accumulation round: the profit learner acts and learns, then
     * the phase switch is evaluated.
     */
    public RoundOutcome profitMaxStep(int round) {
        requirePhase(Phase.PROFIT_MAX);
        RoundOutcome outcome = playRound(round, profitLearner, List.of(profitLearner));
        if (budget >= budgetThreshold) {
            transitionTo(Phase.GFT_MAX, round);
        }
        return outcome;
    }

    /**
     * Gains-from-trade round: the GFT learner acts, both learners learn.
     */
    public RoundOutcome gftMaxStep(int round) {
        requirePhase(Phase.GFT_MAX);
        return playRound(round, gftLearner, List.of(gftLearner, profitLearner));
    }

    private RoundOutcome playRound(int round, HedgeLearner acting, List<HedgeLearner> learners) {
        Expert rawAction = acting.chooseAction();
        Valuations valuations = ContractGuard.requireValidValuations(round, environment.getValuations(round));
        ActionPolicy.Decision decision = policy.decide(rawAction, round, environment);

        for (HedgeLearner learner : learners) {
            if (decision.isRescaled()) {
                learner.updateWeightsWithRescaling(valuations.sell(), valuations.buy(),
                    decision.bounds().lower(), decision.bounds().upper());
            } else {
                learner.updateWeights(valuations.sell(), valuations.buy());
            }
        }

        Expert action = decision.action();
        boolean cleared = action.clearsAgainst(valuations);
        if (cleared) {
            budget += action.spread();
            gft += valuations.potentialGft();
        }
        roundsPlayed++;

        if (decision.isRescaled()) {
            publish(new Event.ActionRescaledEvent(Instant.now(), round, rawAction, action, decision.bounds()));
        }
        RoundOutcome outcome = new RoundOutcome(round, phase, rawAction, action, valuations,
            decision.isRescaled(), cleared, budget, gft);
        publish(new Event.RoundCompletedEvent(Instant.now(), outcome));
        return outcome;
    }

    private void transitionTo(Phase next, int round) {
        if (phase == next) {
            return;
        }
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
        }
        Phase previous = phase;
        phase = next;
        phaseSwitchRound = round;
        log("[PHASE] round %d: %s -> %s (budget=%.4f >= %.4f)", round, previous, next, budget, budgetThreshold);
        publish(new Event.PhaseTransitionEvent(Instant.now(), round, previous, next, budget));
    }

    private void requirePhase(Phase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Step for " + expected + " called while in " + phase);
        }
    }

    // ========================================================================
    // Results
    // ========================================================================

    public double finalGFT() {
        return gft;
    }

    public double budget() {
        return budget;
    }

    public double budgetThreshold() {
        return budgetThreshold;
    }

    public Phase phase() {
        return phase;
    }

    public int horizon() {
        return horizon;
    }

    /** Grid resolution K = floor(sqrt(T)). */
    public int resolution() {
        return resolution;
    }

    public int roundsPlayed() {
        return roundsPlayed;
    }

    /** Round at which the mechanism entered GFT_MAX, or -1 if it never did. */
    public int phaseSwitchRound() {
        return phaseSwitchRound;
    }

    public HedgeLearner profitLearner() {
        return profitLearner;
    }

    public HedgeLearner gftLearner() {
        return gftLearner;
    }

    /**
     * Best fixed rule of the profit grid in hindsight.
     */
    public BestExpert bestFixedExpert() {
        return profitLearner.bestExpertSoFar();
    }

    /**
     * Gains from trade of the best fixed rule minus what the mechanism realized.
     */
    public double regret() {
        return bestFixedExpert().cumulativeGft() - gft;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void publish(Event event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    private void log(String format, Object... args) {
        if (verbose) {
            System.out.println(String.format(format, args));
        }
    }

    @Override
    public String toString() {
        return String.format("%s[T=%d, K=%d, phase=%s, rounds=%d, budget=%.4f, gft=%.4f]",
            getClass().getSimpleName(), horizon, resolution, phase, roundsPlayed, budget, gft);
    }
}
