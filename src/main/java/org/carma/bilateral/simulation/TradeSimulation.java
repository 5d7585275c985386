package org.carma.bilateral.simulation;

import org.carma.bilateral.config.SimulationConfigLoader;
import org.carma.bilateral.config.SimulationConfigLoader.SimulationConfig;
import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.event.EventBus;
import org.carma.bilateral.mechanism.TradeMechanism;

/**
 * Runs one configured experiment: builds the environment and mechanism,
 * records metrics from the event stream, and reports the outcome.
 *
 * Usage:
 * <pre>
 * SimulationConfig config = new SimulationConfigLoader().loadDefault();
 * SimulationResult result = new TradeSimulation(config).run();
 * </pre>
 */
public class TradeSimulation {

    private final SimulationConfig config;
    private final SimulationConfigLoader loader;
    private final EventBus eventBus;

    public TradeSimulation(SimulationConfig config) {
        this(config, new EventBus(false));
    }

    public TradeSimulation(SimulationConfig config, EventBus eventBus) {
        this.config = config;
        this.loader = new SimulationConfigLoader();
        this.eventBus = eventBus;
    }

    public SimulationResult run() {
        return run(loader.buildEnvironment(config));
    }

    /**
     * Run against a caller-supplied environment instead of the configured one.
     */
    public SimulationResult run(Environment environment) {
        SimulationMetrics metrics = new SimulationMetrics().subscribeTo(eventBus);
        TradeMechanism mechanism = loader.buildMechanism(config, environment).setEventBus(eventBus);

        log("Starting simulation " + config.name + "...");
        log("  Mechanism: " + mechanism.getClass().getSimpleName());
        log("  Horizon: " + config.horizon + " rounds, seed " + config.seed);
        log("  Environment: " + config.environment.type);
        log("");

        long start = System.currentTimeMillis();
        mechanism.run();
        long elapsed = System.currentTimeMillis() - start;

        SimulationResult result = new SimulationResult(
            config.name,
            mechanism.getClass().getSimpleName(),
            config.horizon,
            mechanism.finalGFT(),
            mechanism.budget(),
            mechanism.phase(),
            mechanism.phaseSwitchRound(),
            mechanism.bestFixedExpert(),
            mechanism.regret(),
            metrics);

        log("");
        log("Simulation complete in " + elapsed + "ms:");
        log("  Best fixed expert: " + result.bestFixedExpert());
        log("  Regret: " + String.format("%.4f", result.regret()));
        log(metrics.toString());
        return result;
    }

    private void log(String message) {
        if (config.verbose) {
            System.out.println(message);
        }
    }
}
