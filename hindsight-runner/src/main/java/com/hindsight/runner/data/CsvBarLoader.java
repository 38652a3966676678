package com.hindsight.runner.data;

import com.hindsight.core.model.Bar;
import com.hindsight.core.model.BidAskBars;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads bars from {@code timestamp,open,high,low,close[,volume]} CSV files.
 * A leading header line and blank lines are skipped.
 */
public class CsvBarLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvBarLoader.class);

    public List<Bar> load(Path file) throws IOException {
        List<Bar> bars = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || (lineNumber == 1 && !Character.isDigit(trimmed.charAt(0)))) {
                    continue;
                }
                try {
                    bars.add(Bar.fromCsv(trimmed));
                } catch (IllegalArgumentException e) {
                    throw new IOException(file + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }
        log.debug("Loaded {} bars from {}", bars.size(), file);
        return bars;
    }

    public BidAskBars loadBidAsk(Path bidFile, Path askFile) throws IOException {
        return new BidAskBars(load(bidFile), load(askFile));
    }
}
