package com.hindsight.runner.config;

import com.hindsight.core.config.BacktestConfig;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BacktestSettingsTest {

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(BacktestSettingsTest.class.getResource("/" + name).toURI());
    }

    @Test
    @DisplayName("Loads YAML and converts to validated records")
    void loadsYaml() throws Exception {
        BacktestSettings settings = BacktestSettings.load(resource("test-settings.yaml"));

        BacktestConfig config = settings.toConfig();
        assertEquals(250_000, config.startingCapital());
        assertEquals("EUR", config.accountCurrency().getCurrencyCode());
        assertEquals(2, config.slippageTicks());
        assertEquals(0.5, config.commissionRateBp());
        assertTrue(config.frozenAccount());
        assertEquals(BacktestConfig.LogLevel.DEBUG, config.consoleLevel());
        assertEquals(BacktestConfig.LogLevel.ERROR, config.storeLevel());

        MarketModel model = settings.toMarketModel();
        assertEquals(0.1, model.probFillAtBest());
        assertEquals(0.5, model.probFillAtMid());
        assertEquals(7L, model.randomSeed());

        assertEquals(Instant.parse("2020-01-01T00:30:00Z"), settings.getRun().getStart());
        assertNull(settings.getRun().getStop());
        assertEquals(5, settings.getRun().getStepMinutes());
        assertEquals(1, settings.getInstruments().size());
        assertEquals(5, settings.getInstruments().get(0).getPricePrecision());
        assertEquals(2, settings.getStrategies().size());
        assertEquals("baseline", settings.getStrategies().get(1).getId());
    }

    @Test
    @DisplayName("Missing file yields defaults")
    void missingFile(@TempDir Path dir) throws Exception {
        BacktestSettings settings = BacktestSettings.load(dir.resolve("absent.yaml"));

        assertEquals(BacktestConfig.defaults(), settings.toConfig());
        assertEquals(MarketModel.defaults(), settings.toMarketModel());
    }

    @Test
    @DisplayName("Saved settings load back")
    void saveAndLoad(@TempDir Path dir) throws Exception {
        BacktestSettings settings = new BacktestSettings();
        settings.getAccount().setStartingCapital(5000);
        settings.getRun().setStop(Instant.parse("2021-06-01T12:00:00Z"));
        Path file = dir.resolve("nested/settings.yaml");

        settings.save(file);
        BacktestSettings loaded = BacktestSettings.load(file);

        assertEquals(5000, loaded.getAccount().getStartingCapital());
        assertEquals(Instant.parse("2021-06-01T12:00:00Z"), loaded.getRun().getStop());
    }

    @Test
    @DisplayName("Invalid values surface as configuration errors naming the field")
    void invalidValues() {
        BacktestSettings settings = new BacktestSettings();
        settings.getAccount().setCurrency("XXXX");
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, settings::toConfig);
        assertEquals("accountCurrency", e.getField());

        settings.getAccount().setCurrency("USD");
        settings.getAccount().setSlippageTicks(-1);
        assertEquals("slippageTicks",
            assertThrows(InvalidConfigurationException.class, settings::toConfig).getField());

        settings.getMarketModel().setProbSlippage(1.5);
        assertEquals("probSlippage",
            assertThrows(InvalidConfigurationException.class, settings::toMarketModel).getField());
    }
}
