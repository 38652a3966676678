package com.hindsight.runner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hindsight.core.config.BacktestConfig;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.InvalidConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;

/**
 * YAML settings for a command-line backtest. Converted into the validated
 * {@link BacktestConfig} and {@link MarketModel} before use.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BacktestSettings {

    private AccountSettings account = new AccountSettings();
    private LoggingSettings logging = new LoggingSettings();
    private MarketModelSettings marketModel = new MarketModelSettings();
    private RunSettings run = new RunSettings();
    private List<InstrumentSettings> instruments = new ArrayList<>();
    private List<StrategySettings> strategies = new ArrayList<>();

    public AccountSettings getAccount() { return account; }
    public void setAccount(AccountSettings account) { this.account = account; }

    public LoggingSettings getLogging() { return logging; }
    public void setLogging(LoggingSettings logging) { this.logging = logging; }

    public MarketModelSettings getMarketModel() { return marketModel; }
    public void setMarketModel(MarketModelSettings marketModel) { this.marketModel = marketModel; }

    public RunSettings getRun() { return run; }
    public void setRun(RunSettings run) { this.run = run; }

    public List<InstrumentSettings> getInstruments() { return instruments; }
    public void setInstruments(List<InstrumentSettings> instruments) { this.instruments = instruments; }

    public List<StrategySettings> getStrategies() { return strategies; }
    public void setStrategies(List<StrategySettings> strategies) { this.strategies = strategies; }

    public BacktestConfig toConfig() {
        Currency currency;
        try {
            currency = Currency.getInstance(account.getCurrency());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidConfigurationException("accountCurrency", "unknown currency " + account.getCurrency());
        }
        return new BacktestConfig(
            account.getStartingCapital(),
            currency,
            account.getSlippageTicks(),
            account.getCommissionRateBp(),
            account.getMinimumCommission(),
            account.isFrozen(),
            logging.getConsoleLevel(),
            logging.isLogToFile(),
            logging.getLogFilePath(),
            logging.getStoreLevel(),
            logging.isBypass());
    }

    public MarketModel toMarketModel() {
        return new MarketModel(
            marketModel.getProbFillAtBest(),
            marketModel.getProbFillAtMid(),
            marketModel.getProbFillAtCross(),
            marketModel.getProbFillAtStop(),
            marketModel.getProbSlippage(),
            marketModel.getRandomSeed());
    }

    public static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public static BacktestSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new BacktestSettings();
        }
        return mapper().readValue(path.toFile(), BacktestSettings.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper().writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".hindsight", "backtest.yaml");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AccountSettings {
        private double startingCapital = 1_000_000;
        private String currency = "USD";
        private int slippageTicks = 0;
        private double commissionRateBp = 0.20;
        private double minimumCommission = 0.0;
        private boolean frozen = false;

        public double getStartingCapital() { return startingCapital; }
        public void setStartingCapital(double v) { this.startingCapital = v; }

        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }

        public int getSlippageTicks() { return slippageTicks; }
        public void setSlippageTicks(int v) { this.slippageTicks = v; }

        public double getCommissionRateBp() { return commissionRateBp; }
        public void setCommissionRateBp(double v) { this.commissionRateBp = v; }

        public double getMinimumCommission() { return minimumCommission; }
        public void setMinimumCommission(double v) { this.minimumCommission = v; }

        public boolean isFrozen() { return frozen; }
        public void setFrozen(boolean frozen) { this.frozen = frozen; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoggingSettings {
        private BacktestConfig.LogLevel consoleLevel = BacktestConfig.LogLevel.INFO;
        private boolean logToFile = false;
        private String logFilePath;
        private BacktestConfig.LogLevel storeLevel = BacktestConfig.LogLevel.WARN;
        private boolean bypass = false;

        public BacktestConfig.LogLevel getConsoleLevel() { return consoleLevel; }
        public void setConsoleLevel(BacktestConfig.LogLevel v) { this.consoleLevel = v; }

        public boolean isLogToFile() { return logToFile; }
        public void setLogToFile(boolean logToFile) { this.logToFile = logToFile; }

        public String getLogFilePath() { return logFilePath; }
        public void setLogFilePath(String logFilePath) { this.logFilePath = logFilePath; }

        public BacktestConfig.LogLevel getStoreLevel() { return storeLevel; }
        public void setStoreLevel(BacktestConfig.LogLevel v) { this.storeLevel = v; }

        public boolean isBypass() { return bypass; }
        public void setBypass(boolean bypass) { this.bypass = bypass; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarketModelSettings {
        private double probFillAtBest = 0.0;
        private double probFillAtMid = 0.5;
        private double probFillAtCross = 1.0;
        private double probFillAtStop = 1.0;
        private double probSlippage = 0.0;
        private long randomSeed = MarketModel.DEFAULT_SEED;

        public double getProbFillAtBest() { return probFillAtBest; }
        public void setProbFillAtBest(double v) { this.probFillAtBest = v; }

        public double getProbFillAtMid() { return probFillAtMid; }
        public void setProbFillAtMid(double v) { this.probFillAtMid = v; }

        public double getProbFillAtCross() { return probFillAtCross; }
        public void setProbFillAtCross(double v) { this.probFillAtCross = v; }

        public double getProbFillAtStop() { return probFillAtStop; }
        public void setProbFillAtStop(double v) { this.probFillAtStop = v; }

        public double getProbSlippage() { return probSlippage; }
        public void setProbSlippage(double v) { this.probSlippage = v; }

        public long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }
    }

    /**
     * Time range to replay. Missing bounds default to the ends of the minute index.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RunSettings {
        private Instant start;
        private Instant stop;
        private int stepMinutes = 1;

        public Instant getStart() { return start; }
        public void setStart(Instant start) { this.start = start; }

        public Instant getStop() { return stop; }
        public void setStop(Instant stop) { this.stop = stop; }

        public int getStepMinutes() { return stepMinutes; }
        public void setStepMinutes(int stepMinutes) { this.stepMinutes = stepMinutes; }
    }

    /**
     * One instrument and its minute bid/ask CSV files, relative to the settings file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstrumentSettings {
        private String symbol;
        private int pricePrecision = 5;
        private String bidFile;
        private String askFile;

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }

        public int getPricePrecision() { return pricePrecision; }
        public void setPricePrecision(int pricePrecision) { this.pricePrecision = pricePrecision; }

        public String getBidFile() { return bidFile; }
        public void setBidFile(String bidFile) { this.bidFile = bidFile; }

        public String getAskFile() { return askFile; }
        public void setAskFile(String askFile) { this.askFile = askFile; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StrategySettings {
        private String type = "noop";
        private String id;
        private String symbol;
        private int fastPeriod = 10;
        private int slowPeriod = 30;
        private double quantity = 100_000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }

        public int getFastPeriod() { return fastPeriod; }
        public void setFastPeriod(int fastPeriod) { this.fastPeriod = fastPeriod; }

        public int getSlowPeriod() { return slowPeriod; }
        public void setSlowPeriod(int slowPeriod) { this.slowPeriod = slowPeriod; }

        public double getQuantity() { return quantity; }
        public void setQuantity(double quantity) { this.quantity = quantity; }
    }
}
