package org.carma.bilateral.config;

import org.carma.bilateral.environment.ConstantEnvironment;
import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.environment.StochasticEnvironment;
import org.carma.bilateral.mechanism.ConstrainedTradeMechanism;
import org.carma.bilateral.mechanism.TradeMechanism;
import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.Valuations;
import org.carma.bilateral.safety.InvalidConfigurationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads simulation settings from YAML and builds the environment and
 * mechanism they describe.
 *
 * Example:
 * <pre>
 * name: uniform-constrained
 * horizon: 400
 * seed: 42
 * constrained: true
 * verbose: false
 * environment:
 *   type: stochastic      # stochastic | constant
 *   boundWidth: 0.5
 * </pre>
 */
public class SimulationConfigLoader {

    /** Classpath resource used when no file is given. */
    public static final String DEFAULT_RESOURCE = "simulation.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for one run.
     */
    public static class SimulationConfig {
        public String name = "unnamed";
        public int horizon = 100;
        public long seed = 42;
        public boolean constrained = false;
        public boolean verbose = false;
        public EnvironmentConfig environment = new EnvironmentConfig();

        @Override
        public String toString() {
            return String.format("SimulationConfig[name=%s, T=%d, seed=%d, constrained=%s, env=%s]",
                name, horizon, seed, constrained, environment.type);
        }
    }

    /**
     * Environment settings. Which fields apply depends on {@link #type}.
     */
    public static class EnvironmentConfig {
        public String type = "stochastic";
        public double sell = 0.3;          // constant only
        public double buy = 0.7;           // constant only
        public double lower = 0.0;         // constant bounds
        public double upper = 1.0;
        public double boundWidth = 0.5;    // stochastic bounds
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public SimulationConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a configuration file.
     */
    public SimulationConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Simulation config not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return parseDocument(yaml.load(is));
        }
    }

    /**
     * Load a configuration from the classpath.
     */
    public SimulationConfig loadResource(String resource) throws IOException {
        try (InputStream is = SimulationConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Simulation config resource not found: " + resource);
            }
            return parseDocument(yaml.load(is));
        }
    }

    public SimulationConfig loadDefault() throws IOException {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Parse YAML text. Mostly useful for tests and inline configs.
     */
    public SimulationConfig parse(String text) {
        return parseDocument(yaml.load(text));
    }

    @SuppressWarnings("unchecked")
    private SimulationConfig parseDocument(Object document) {
        if (!(document instanceof Map)) {
            throw new InvalidConfigurationException("Simulation config must be a YAML mapping");
        }
        Map<String, Object> raw = (Map<String, Object>) document;

        SimulationConfig config = new SimulationConfig();
        config.name = getString(raw, "name", config.name);
        config.horizon = getInt(raw, "horizon", config.horizon);
        config.seed = getLong(raw, "seed", config.seed);
        config.constrained = getBoolean(raw, "constrained", config.constrained);
        config.verbose = getBoolean(raw, "verbose", config.verbose);

        Map<String, Object> envMap = (Map<String, Object>) raw.get("environment");
        if (envMap != null) {
            EnvironmentConfig env = config.environment;
            env.type = getString(envMap, "type", env.type).toLowerCase(Locale.ROOT);
            env.sell = getDouble(envMap, "sell", env.sell);
            env.buy = getDouble(envMap, "buy", env.buy);
            env.lower = getDouble(envMap, "lower", env.lower);
            env.upper = getDouble(envMap, "upper", env.upper);
            env.boundWidth = getDouble(envMap, "boundWidth", env.boundWidth);
        }

        validate(config);
        return config;
    }

    private void validate(SimulationConfig config) {
        if (config.horizon <= 0) {
            throw new InvalidConfigurationException("horizon must be positive, got " + config.horizon);
        }
        String type = config.environment.type;
        if (!type.equals("stochastic") && !type.equals("constant")) {
            throw new InvalidConfigurationException("Unknown environment type: " + type
                + " (expected stochastic or constant)");
        }
        if (config.constrained && type.equals("stochastic") && config.environment.boundWidth <= 0) {
            throw new InvalidConfigurationException("A constrained stochastic environment needs boundWidth > 0");
        }
        if (config.constrained && config.environment.lower > config.environment.upper) {
            throw new InvalidConfigurationException(String.format(
                "lower bound %.4f exceeds upper bound %.4f", config.environment.lower, config.environment.upper));
        }
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build the environment described by the configuration.
     */
    public Environment buildEnvironment(SimulationConfig config) {
        EnvironmentConfig env = config.environment;
        switch (env.type) {
            case "constant":
                PriceBounds bounds = config.constrained ? new PriceBounds(env.lower, env.upper) : null;
                return new ConstantEnvironment(config.horizon, new Valuations(env.sell, env.buy), bounds);
            case "stochastic":
                return new StochasticEnvironment(config.horizon, config.seed,
                    config.constrained ? env.boundWidth : 0.0);
            default:
                throw new InvalidConfigurationException("Unknown environment type: " + env.type);
        }
    }

    /**
     * Build the mechanism described by the configuration. Action sampling is
     * seeded from {@code seed} so runs are reproducible.
     */
    public TradeMechanism buildMechanism(SimulationConfig config, Environment environment) {
        Random random = new Random(config.seed);
        TradeMechanism mechanism = config.constrained
            ? new ConstrainedTradeMechanism(config.horizon, environment, random)
            : new TradeMechanism(config.horizon, environment, random);
        return mechanism.setVerbose(config.verbose);
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        throw new InvalidConfigurationException("'" + key + "' must be an integer, got: " + value);
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new InvalidConfigurationException("'" + key + "' must be an integer, got: " + value);
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new InvalidConfigurationException("'" + key + "' must be a number, got: " + value);
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
