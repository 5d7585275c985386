package org.carma.bilateral.simulation;

import org.carma.bilateral.event.Event;
import org.carma.bilateral.event.EventBus;
import org.carma.bilateral.model.Phase;
import org.carma.bilateral.model.RoundOutcome;

import java.util.*;

/**
 * Tracks budget and gains-from-trade trajectories of a mechanism run.
 */
public class SimulationMetrics {

    private final List<Double> budgetHistory;
    private final List<Double> gftHistory;
    private final Map<Phase, Integer> roundsByPhase;
    private int clearedRounds;
    private int rescaledRounds;
    private int phaseSwitchRound;

    public SimulationMetrics() {
        this.budgetHistory = new ArrayList<>();
        this.gftHistory = new ArrayList<>();
        this.roundsByPhase = new EnumMap<>(Phase.class);
        this.phaseSwitchRound = -1;
    }

    /**
     * Record rounds and phase transitions published on the bus.
     */
    public SimulationMetrics subscribeTo(EventBus bus) {
        bus.subscribe(Event.RoundCompletedEvent.class, e -> recordRound(e.outcome()));
        bus.subscribe(Event.PhaseTransitionEvent.class, e -> recordPhaseTransition(e.round()));
        return this;
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public void recordRound(RoundOutcome outcome) {
        budgetHistory.add(outcome.budgetAfter());
        gftHistory.add(outcome.gftAfter());
        roundsByPhase.merge(outcome.phase(), 1, Integer::sum);
        if (outcome.cleared()) clearedRounds++;
        if (outcome.rescaled()) rescaledRounds++;
    }

    public void recordPhaseTransition(int round) {
        if (phaseSwitchRound < 0) {
            phaseSwitchRound = round;
        }
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public int getRoundCount() {
        return gftHistory.size();
    }

    public int getRoundsIn(Phase phase) {
        return roundsByPhase.getOrDefault(phase, 0);
    }

    public int getPhaseSwitchRound() {
        return phaseSwitchRound;
    }

    public double getFinalGft() {
        if (gftHistory.isEmpty()) return 0;
        return gftHistory.get(gftHistory.size() - 1);
    }

    public double getFinalBudget() {
        if (budgetHistory.isEmpty()) return 0;
        return budgetHistory.get(budgetHistory.size() - 1);
    }

    public double getPeakBudget() {
        return budgetHistory.stream().mapToDouble(Double::doubleValue).max().orElse(0);
    }

    public double getAverageGftPerRound() {
        if (gftHistory.isEmpty()) return 0;
        return getFinalGft() / gftHistory.size();
    }

    public double getClearRate() {
        if (gftHistory.isEmpty()) return 0;
        return (double) clearedRounds / gftHistory.size();
    }

    public double getRescaleRate() {
        if (gftHistory.isEmpty()) return 0;
        return (double) rescaledRounds / gftHistory.size();
    }

    public int getClearedRounds() {
        return clearedRounds;
    }

    public int getRescaledRounds() {
        return rescaledRounds;
    }

    public List<Double> getBudgetHistory() {
        return Collections.unmodifiableList(budgetHistory);
    }

    public List<Double> getGftHistory() {
        return Collections.unmodifiableList(gftHistory);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SimulationMetrics[\n");
        sb.append("  Rounds: ").append(getRoundCount())
          .append(" (profit=").append(getRoundsIn(Phase.PROFIT_MAX))
          .append(", gft=").append(getRoundsIn(Phase.GFT_MAX)).append(")\n");
        sb.append("  Phase switch round: ").append(phaseSwitchRound).append("\n");
        sb.append("  Final GFT: ").append(String.format("%.4f", getFinalGft()))
          .append(" (avg/round ").append(String.format("%.4f", getAverageGftPerRound())).append(")\n");
        sb.append("  Final budget: ").append(String.format("%.4f", getFinalBudget()))
          .append(" (peak ").append(String.format("%.4f", getPeakBudget())).append(")\n");
        sb.append("  Clear rate: ").append(String.format("%.1f%%", getClearRate() * 100)).append("\n");
        sb.append("  Rescale rate: ").append(String.format("%.1f%%", getRescaleRate() * 100)).append("\n");
        sb.append("]");
        return sb.toString();
    }
}
