package org.quarry.formula.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Typed view of the {@code formula} configuration block.
 *
 * @param mentionTimeout Upper bound for a single external mention lookup.
 * @param strictReferences Whether unknown identifiers fail instead of evaluating to their name.
 * @param errorDisplayValue Display text of a failed evaluation.
 * @param parseCacheSize Number of parsed formulas to memoize; 0 disables the cache.
 */
public record FormulaEngineConfig(
        Duration mentionTimeout,
        boolean strictReferences,
        String errorDisplayValue,
        int parseCacheSize
) {
    /** Root path of the engine settings. */
    public static final String ROOT_PATH = "formula";

    public FormulaEngineConfig {
        if (mentionTimeout == null || mentionTimeout.isNegative() || mentionTimeout.isZero()) {
            throw new IllegalArgumentException("mentionTimeout must be positive, got " + mentionTimeout);
        }
        if (parseCacheSize < 0) {
            throw new IllegalArgumentException("parseCacheSize must not be negative, got " + parseCacheSize);
        }
        if (errorDisplayValue == null) {
            errorDisplayValue = "Error";
        }
    }

    /**
     * The built-in defaults of {@code reference.conf}.
     */
    public static FormulaEngineConfig defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Reads the engine settings from a configuration that contains a {@code formula} block.
     * @param config A resolved configuration, e.g. from {@link FormulaConfigLoader#load()}.
     * @return The typed settings.
     * @throws com.typesafe.config.ConfigException if a setting is missing or malformed.
     */
    public static FormulaEngineConfig fromConfig(Config config) {
        Config formula = config.getConfig(ROOT_PATH);
        return new FormulaEngineConfig(
                formula.getDuration("evaluation.mention-timeout"),
                formula.getBoolean("evaluation.strict-references"),
                formula.getString("evaluation.error-display-value"),
                formula.getInt("parser.cache-size"));
    }

    /**
     * @return A copy with the given mention timeout.
     */
    public FormulaEngineConfig withMentionTimeout(Duration timeout) {
        return new FormulaEngineConfig(timeout, strictReferences, errorDisplayValue, parseCacheSize);
    }

    /**
     * @return A copy with strict references switched on or off.
     */
    public FormulaEngineConfig withStrictReferences(boolean strict) {
        return new FormulaEngineConfig(mentionTimeout, strict, errorDisplayValue, parseCacheSize);
    }
}
