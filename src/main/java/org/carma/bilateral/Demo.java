package org.carma.bilateral;

import org.carma.bilateral.config.SimulationConfigLoader;
import org.carma.bilateral.config.SimulationConfigLoader.SimulationConfig;
import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.simulation.SimulationResult;
import org.carma.bilateral.simulation.TradeSimulation;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.*;

/**
 * Command-line entry point for the bilateral trade mechanism.
 *
 * Usage:
 *   java Demo                      # Run the bundled simulation.yaml
 *   java Demo path/to/run.yaml     # Run a configuration file
 *   java Demo --compare [file]     # Run unconstrained and constrained on the same draws
 */
public class Demo {

    private static final String SEP = "═".repeat(72);
    private static final String SUBSEP = "─".repeat(60);

    public static void main(String[] args) {
        List<String> argList = new ArrayList<>(Arrays.asList(args));
        boolean compare = argList.remove("--compare");

        System.out.println(SEP);
        System.out.println("   ONLINE POSTED-PRICE MECHANISM FOR REPEATED BILATERAL TRADE");
        System.out.println(SEP);
        System.out.println();

        SimulationConfigLoader loader = new SimulationConfigLoader();
        SimulationConfig config;
        try {
            config = argList.isEmpty() ? loader.loadDefault() : loader.load(Paths.get(argList.get(0)));
        } catch (IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(1);
            return;
        }

        if (compare) {
            runComparison(loader, config);
        } else {
            printResult(new TradeSimulation(config).run());
        }

        System.out.println(SEP);
    }

    static void runComparison(SimulationConfigLoader loader, SimulationConfig config) {
        SimulationConfig constrained = copyOf(config);
        constrained.constrained = true;
        constrained.name = config.name + "-constrained";
        if (constrained.environment.boundWidth <= 0) {
            constrained.environment.boundWidth = 0.5;
        }
        SimulationConfig unconstrained = copyOf(config);
        unconstrained.constrained = false;
        unconstrained.name = config.name + "-unconstrained";

        // Both runs see the valuations of the constrained environment
        Environment environment = loader.buildEnvironment(constrained);

        System.out.println("COMPARISON: UNCONSTRAINED VS CONSTRAINED");
        System.out.println(SUBSEP);
        SimulationResult free = new TradeSimulation(unconstrained).run(environment);
        SimulationResult bounded = new TradeSimulation(constrained).run(environment);
        printResult(free);
        printResult(bounded);
        System.out.printf("GFT lost to constraints: %.4f%n", free.finalGft() - bounded.finalGft());
    }

    static void printResult(SimulationResult result) {
        System.out.println(SUBSEP);
        System.out.println(result.name() + " (" + result.mechanism() + ")");
        System.out.printf("  Final GFT:        %.4f%n", result.finalGft());
        System.out.printf("  Budget:           %.4f%n", result.budget());
        System.out.printf("  Phase:            %s (switched at round %d)%n",
            result.finalPhase(), result.phaseSwitchRound());
        System.out.printf("  Best fixed rule:  %s%n", result.bestFixedExpert());
        System.out.printf("  Regret:           %.4f%n", result.regret());
        System.out.println();
    }

    private static SimulationConfig copyOf(SimulationConfig source) {
        SimulationConfig copy = new SimulationConfig();
        copy.name = source.name;
        copy.horizon = source.horizon;
        copy.seed = source.seed;
        copy.constrained = source.constrained;
        copy.verbose = source.verbose;
        copy.environment.type = source.environment.type;
        copy.environment.sell = source.environment.sell;
        copy.environment.buy = source.environment.buy;
        copy.environment.lower = source.environment.lower;
        copy.environment.upper = source.environment.upper;
        copy.environment.boundWidth = source.environment.boundWidth;
        return copy;
    }
}
