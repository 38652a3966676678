package com.hindsight.runner;

import com.hindsight.core.config.BacktestConfig;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.BacktestException;
import com.hindsight.core.exception.InvalidConfigurationException;
import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.Resolution;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.BacktestData;
import com.hindsight.engine.BacktestEngine;
import com.hindsight.engine.trading.TradingStrategy;
import com.hindsight.runner.config.BacktestSettings;
import com.hindsight.runner.config.BacktestSettings.InstrumentSettings;
import com.hindsight.runner.data.CsvBarLoader;
import com.hindsight.runner.log.LogStore;
import com.hindsight.runner.log.LoggingConfigurator;
import com.hindsight.runner.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line backtest: {@code BacktestRunnerApp [settings.yaml]}.
 *
 * Loads CSV minute bars for the configured instruments, runs the configured strategies
 * and prints the performance statistics and the last stored log lines.
 */
public class BacktestRunnerApp {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunnerApp.class);

    private static final int STORED_LINES_SHOWN = 20;

    public static void main(String[] args) {
        Path settingsPath = args.length > 0 ? Path.of(args[0]) : BacktestSettings.defaultPath();
        int status = new BacktestRunnerApp().run(settingsPath, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the backtest described by the settings file. Returns the process exit status.
     */
    public int run(Path settingsPath, PrintStream out) {
        try {
            BacktestSettings settings = BacktestSettings.load(settingsPath);
            BacktestConfig config = settings.toConfig();
            MarketModel marketModel = settings.toMarketModel();
            LoggingConfigurator.apply(config);
            log.info("Backtest settings loaded from {}", settingsPath);

            Path baseDir = settingsPath.toAbsolutePath().getParent();
            List<Instrument> instruments = new ArrayList<>();
            BacktestData data = loadData(settings, baseDir, instruments);
            List<TradingStrategy> strategies = StrategyFactory.create(settings.getStrategies());

            BacktestEngine engine = new BacktestEngine(instruments, data, strategies, config, marketModel);
            try {
                List<Instant> index = engine.minuteIndex();
                BacktestSettings.RunSettings run = settings.getRun();
                Instant start = run.getStart() != null ? run.getStart() : index.get(0);
                Instant stop = run.getStop() != null ? run.getStop() : index.get(index.size() - 1);
                engine.run(start, stop, run.getStepMinutes());

                printStats(engine.getPerformanceStats(), config, out);
                printStoredLines(out);
            } finally {
                engine.dispose();
            }
            return 0;
        } catch (BacktestException | IOException e) {
            log.error("Backtest failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private BacktestData loadData(BacktestSettings settings, Path baseDir, List<Instrument> instruments)
            throws IOException {
        if (settings.getInstruments().isEmpty()) {
            throw new InvalidConfigurationException("instruments", "at least one instrument is required");
        }
        CsvBarLoader loader = new CsvBarLoader();
        BacktestData.Builder builder = BacktestData.builder();
        for (int i = 0; i < settings.getInstruments().size(); i++) {
            InstrumentSettings is = settings.getInstruments().get(i);
            if (is.getSymbol() == null || is.getBidFile() == null || is.getAskFile() == null) {
                throw new InvalidConfigurationException("instruments[" + i + "]",
                    "symbol, bidFile and askFile are required");
            }
            Symbol symbol;
            Instrument instrument;
            try {
                symbol = Symbol.parse(is.getSymbol());
                instrument = Instrument.fxPair(symbol, is.getPricePrecision());
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("instruments[" + i + "].symbol", e.getMessage());
            }
            instruments.add(instrument);
            builder.bars(symbol, Resolution.MINUTE,
                loader.loadBidAsk(baseDir.resolve(is.getBidFile()), baseDir.resolve(is.getAskFile())));
        }
        return builder.build();
    }

    private void printStats(Map<String, Double> stats, BacktestConfig config, PrintStream out) {
        out.println();
        out.println("Performance (" + config.accountCurrency() + ")");
        out.println("-------------------------------------------------");
        stats.forEach((name, value) -> out.printf("%-18s %,18.4f%n", name, value));
    }

    private void printStoredLines(PrintStream out) {
        List<String> lines = LogStore.getInstance().lastLines(STORED_LINES_SHOWN);
        if (lines.isEmpty()) {
            return;
        }
        out.println();
        out.println("Last " + lines.size() + " stored log lines");
        out.println("-------------------------------------------------");
        lines.forEach(out::println);
    }
}
