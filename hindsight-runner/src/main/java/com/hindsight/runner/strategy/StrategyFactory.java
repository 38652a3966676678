package com.hindsight.runner.strategy;

import com.hindsight.core.exception.InvalidConfigurationException;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.trading.TradingStrategy;
import com.hindsight.runner.config.BacktestSettings.StrategySettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds strategies from their settings by type name.
 */
public final class StrategyFactory {

    public static final String MA_CROSS = "ma-cross";
    public static final String NOOP = "noop";

    private StrategyFactory() {
    }

    public static List<TradingStrategy> create(List<StrategySettings> settings) {
        List<TradingStrategy> strategies = new ArrayList<>();
        for (int i = 0; i < settings.size(); i++) {
            strategies.add(create(settings.get(i), i));
        }
        return strategies;
    }

    public static TradingStrategy create(StrategySettings settings, int index) {
        String type = settings.getType() == null ? NOOP : settings.getType().trim().toLowerCase();
        String id = settings.getId() != null ? settings.getId() : type + "-" + (index + 1);
        return switch (type) {
            case MA_CROSS -> {
                if (settings.getSymbol() == null) {
                    throw new InvalidConfigurationException("strategies[" + index + "].symbol",
                        "is required for " + MA_CROSS);
                }
                try {
                    yield new MovingAverageCrossStrategy(id, Symbol.parse(settings.getSymbol()),
                        settings.getFastPeriod(), settings.getSlowPeriod(), settings.getQuantity());
                } catch (IllegalArgumentException e) {
                    throw new InvalidConfigurationException("strategies[" + index + "]", e.getMessage());
                }
            }
            case NOOP -> new NoOpStrategy(id);
            default -> throw new InvalidConfigurationException("strategies[" + index + "].type",
                "unknown strategy type " + settings.getType());
        };
    }
}
