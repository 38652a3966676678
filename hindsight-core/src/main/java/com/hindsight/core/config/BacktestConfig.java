package com.hindsight.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hindsight.core.exception.InvalidConfigurationException;

import java.util.Currency;

/**
 * Configuration for a backtest run.
 *
 * Validated on construction; an instance that exists is always within bounds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    double startingCapital,
    Currency accountCurrency,
    int slippageTicks,
    double commissionRateBp,
    double minimumCommission,
    boolean frozenAccount,
    LogLevel consoleLevel,
    boolean logToFile,
    String logFilePath,
    LogLevel storeLevel,
    boolean bypassLogging
) {
    public BacktestConfig {
        if (!(startingCapital > 0)) {
            throw new InvalidConfigurationException("startingCapital",
                "must be positive, was " + startingCapital);
        }
        if (accountCurrency == null) {
            throw new InvalidConfigurationException("accountCurrency", "is required");
        }
        if (slippageTicks < 0) {
            throw new InvalidConfigurationException("slippageTicks",
                "must not be negative, was " + slippageTicks);
        }
        if (!(commissionRateBp >= 0)) {
            throw new InvalidConfigurationException("commissionRateBp",
                "must not be negative, was " + commissionRateBp);
        }
        if (!(minimumCommission >= 0)) {
            throw new InvalidConfigurationException("minimumCommission",
                "must not be negative, was " + minimumCommission);
        }
        if (logToFile && (logFilePath == null || logFilePath.isBlank())) {
            throw new InvalidConfigurationException("logFilePath", "is required when logToFile is set");
        }
        if (consoleLevel == null) consoleLevel = LogLevel.INFO;
        if (storeLevel == null) storeLevel = LogLevel.WARN;
    }

    /**
     * Trading-only constructor; logging options take their defaults.
     */
    public BacktestConfig(double startingCapital, Currency accountCurrency,
                          int slippageTicks, double commissionRateBp) {
        this(startingCapital, accountCurrency, slippageTicks, commissionRateBp,
            0.0, false, LogLevel.INFO, false, null, LogLevel.WARN, false);
    }

    /**
     * Create default config: 1,000,000 USD, no slippage, 0.20 bp commission.
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig(1_000_000.0, Currency.getInstance("USD"), 0, 0.20);
    }

    public BacktestConfig withStartingCapital(double capital) {
        return new BacktestConfig(capital, accountCurrency, slippageTicks, commissionRateBp,
            minimumCommission, frozenAccount, consoleLevel, logToFile, logFilePath, storeLevel, bypassLogging);
    }

    public BacktestConfig withSlippageTicks(int ticks) {
        return new BacktestConfig(startingCapital, accountCurrency, ticks, commissionRateBp,
            minimumCommission, frozenAccount, consoleLevel, logToFile, logFilePath, storeLevel, bypassLogging);
    }

    public BacktestConfig withFrozenAccount(boolean frozen) {
        return new BacktestConfig(startingCapital, accountCurrency, slippageTicks, commissionRateBp,
            minimumCommission, frozen, consoleLevel, logToFile, logFilePath, storeLevel, bypassLogging);
    }

    /**
     * Logging verbosity, independent of any logging backend.
     */
    public enum LogLevel {
        TRACE, DEBUG, INFO, WARN, ERROR, OFF
    }
}
