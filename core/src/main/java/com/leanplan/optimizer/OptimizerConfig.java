package com.leanplan.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable optimizer settings.
 *
 * <p>{@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code leanplan.optimizer.verifySchema} (default {@code true}): check that every
 *       rewrite keeps the root schema</li>
 *   <li>{@code leanplan.optimizer.logPlans} (default {@code false}): log input and rewritten
 *       trees at INFO rather than DEBUG</li>
 * </ul>
 * A value other than {@code true}/{@code false} is ignored with a warning.
 */
public final class OptimizerConfig {

    private static final Logger logger = LoggerFactory.getLogger(OptimizerConfig.class);

    public static final String PROP_VERIFY_SCHEMA = "leanplan.optimizer.verifySchema";
    public static final String PROP_LOG_PLANS = "leanplan.optimizer.logPlans";

    private static final boolean DEFAULT_VERIFY_SCHEMA = true;
    private static final boolean DEFAULT_LOG_PLANS = false;

    private final boolean verifySchema;
    private final boolean logPlans;

    private OptimizerConfig(boolean verifySchema, boolean logPlans) {
        this.verifySchema = verifySchema;
        this.logPlans = logPlans;
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     *
     * @return the default configuration
     */
    public static OptimizerConfig defaults() {
        return new OptimizerConfig(DEFAULT_VERIFY_SCHEMA, DEFAULT_LOG_PLANS);
    }

    /**
     * Reads the configuration from JVM system properties.
     *
     * @return the configuration
     */
    public static OptimizerConfig fromSystemProperties() {
        return new OptimizerConfig(
            getConfiguredFlag(PROP_VERIFY_SCHEMA, DEFAULT_VERIFY_SCHEMA),
            getConfiguredFlag(PROP_LOG_PLANS, DEFAULT_LOG_PLANS));
    }

    public OptimizerConfig withVerifySchema(boolean verifySchema) {
        return new OptimizerConfig(verifySchema, logPlans);
    }

    public OptimizerConfig withLogPlans(boolean logPlans) {
        return new OptimizerConfig(verifySchema, logPlans);
    }

    public boolean verifySchema() {
        return verifySchema;
    }

    public boolean logPlans() {
        return logPlans;
    }

    private static boolean getConfiguredFlag(String property, boolean defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        logger.warn("Ignoring invalid value '{}' for {}, using default {}", value, property, defaultValue);
        return defaultValue;
    }

    @Override
    public String toString() {
        return "OptimizerConfig{verifySchema=" + verifySchema + ", logPlans=" + logPlans + "}";
    }
}
