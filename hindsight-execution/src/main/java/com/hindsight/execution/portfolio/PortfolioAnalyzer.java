package com.hindsight.execution.portfolio;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Performance statistics over realized trades and daily account returns.
 *
 * <p>Balances and benchmark prices are sampled at every step; the last sample of each
 * UTC day is that day's close. Returns are annualized over 252 trading days. A statistic
 * without enough data to be defined reports 0.0.
 */
public class PortfolioAnalyzer {

    public static final int TRADING_DAYS = 252;

    private final double startingBalance;
    private final List<Double> tradePnls = new ArrayList<>();
    private final TreeMap<LocalDate, Double> dailyBalances = new TreeMap<>();
    private final TreeMap<LocalDate, Double> dailyBenchmark = new TreeMap<>();

    public PortfolioAnalyzer(double startingBalance) {
        this.startingBalance = startingBalance;
    }

    public void addTrade(double pnl) {
        tradePnls.add(pnl);
    }

    public void addBalance(Instant time, double balance) {
        dailyBalances.put(day(time), balance);
    }

    public void addBenchmarkPrice(Instant time, double price) {
        dailyBenchmark.put(day(time), price);
    }

    public void reset() {
        tradePnls.clear();
        dailyBalances.clear();
        dailyBenchmark.clear();
    }

    public List<Double> tradePnls() {
        return List.copyOf(tradePnls);
    }

    /**
     * Daily returns of the account balance, the first day measured against the starting balance.
     */
    public TreeMap<LocalDate, Double> dailyReturns() {
        TreeMap<LocalDate, Double> returns = new TreeMap<>();
        double previous = startingBalance;
        for (Map.Entry<LocalDate, Double> e : dailyBalances.entrySet()) {
            returns.put(e.getKey(), previous != 0 ? e.getValue() / previous - 1.0 : 0.0);
            previous = e.getValue();
        }
        return returns;
    }

    public TreeMap<LocalDate, Double> benchmarkReturns() {
        TreeMap<LocalDate, Double> returns = new TreeMap<>();
        Double previous = null;
        for (Map.Entry<LocalDate, Double> e : dailyBenchmark.entrySet()) {
            if (previous != null) {
                returns.put(e.getKey(), e.getValue() / previous - 1.0);
            }
            previous = e.getValue();
        }
        return returns;
    }

    /**
     * All statistics by name, in reporting order.
     */
    public Map<String, Double> getPerformanceStats() {
        Map<String, Double> stats = new LinkedHashMap<>();

        double pnl = dailyBalances.isEmpty() ? 0.0 : dailyBalances.lastEntry().getValue() - startingBalance;
        stats.put("PNL", pnl);
        stats.put("PNL%", safe(pnl / startingBalance * 100.0));

        double[] winners = tradePnls.stream().mapToDouble(Double::doubleValue).filter(p -> p > 0).toArray();
        double[] losers = tradePnls.stream().mapToDouble(Double::doubleValue).filter(p -> p < 0).toArray();
        stats.put("MaxWinner", max(winners));
        stats.put("AvgWinner", mean(winners));
        stats.put("MinWinner", min(winners));
        stats.put("MinLoser", max(losers));
        stats.put("AvgLoser", mean(losers));
        stats.put("MaxLoser", min(losers));

        int total = tradePnls.size();
        double winRate = total == 0 ? 0.0 : (double) winners.length / total;
        double lossRate = total == 0 ? 0.0 : (double) losers.length / total;
        stats.put("WinRate", winRate);
        stats.put("Expectancy", winRate * mean(winners) + lossRate * mean(losers));

        double[] returns = values(dailyReturns());
        double cumReturn = cumulativeReturn(returns);
        double annualReturn = returns.length == 0 ? 0.0
            : safe(Math.pow(1.0 + cumReturn, (double) TRADING_DAYS / returns.length) - 1.0);
        double maxDrawdown = maxDrawdown(returns);
        double std = Math.sqrt(variance(returns));
        double meanReturn = mean(returns);

        stats.put("AnnualReturn", annualReturn);
        stats.put("CumReturn", cumReturn);
        stats.put("MaxDrawdown", maxDrawdown);
        stats.put("AnnualVol", std * Math.sqrt(TRADING_DAYS));
        stats.put("SharpeRatio", safe(meanReturn / std * Math.sqrt(TRADING_DAYS)));
        stats.put("CalmarRatio", safe(annualReturn / Math.abs(maxDrawdown)));
        stats.put("SortinoRatio", safe(meanReturn * TRADING_DAYS / (downsideDeviation(returns) * Math.sqrt(TRADING_DAYS))));
        stats.put("OmegaRatio", omega(returns));
        stats.put("ReturnsMean", meanReturn);
        stats.put("ReturnsVariance", variance(returns));
        stats.put("ReturnsSkew", skew(returns));
        stats.put("ReturnsKurtosis", kurtosis(returns));
        stats.put("TailRatio", safe(Math.abs(percentile(returns, 95)) / Math.abs(percentile(returns, 5))));

        double[][] aligned = alignWithBenchmark();
        double beta = safe(covariance(aligned[0], aligned[1]) / variance(aligned[1]));
        double alpha = aligned[0].length == 0 ? 0.0
            : safe((mean(aligned[0]) - beta * mean(aligned[1])) * TRADING_DAYS);
        stats.put("Alpha", alpha);
        stats.put("Beta", beta);
        return stats;
    }

    private double[][] alignWithBenchmark() {
        TreeMap<LocalDate, Double> account = dailyReturns();
        TreeMap<LocalDate, Double> benchmark = benchmarkReturns();
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<LocalDate, Double> e : account.entrySet()) {
            Double b = benchmark.get(e.getKey());
            if (b != null) {
                pairs.add(new double[] {e.getValue(), b});
            }
        }
        double[] a = new double[pairs.size()];
        double[] b = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            a[i] = pairs.get(i)[0];
            b[i] = pairs.get(i)[1];
        }
        return new double[][] {a, b};
    }

    private static LocalDate day(Instant time) {
        return LocalDate.ofInstant(time, ZoneOffset.UTC);
    }

    private static double[] values(TreeMap<LocalDate, Double> series) {
        return series.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    // ========== Formulas ==========

    static double safe(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    static double max(double[] xs) {
        return Arrays.stream(xs).max().orElse(0.0);
    }

    static double min(double[] xs) {
        return Arrays.stream(xs).min().orElse(0.0);
    }

    static double mean(double[] xs) {
        return Arrays.stream(xs).average().orElse(0.0);
    }

    /** Sample variance (n - 1). */
    static double variance(double[] xs) {
        if (xs.length < 2) {
            return 0.0;
        }
        double m = mean(xs);
        double sum = 0;
        for (double x : xs) {
            sum += (x - m) * (x - m);
        }
        return sum / (xs.length - 1);
    }

    static double covariance(double[] xs, double[] ys) {
        if (xs.length < 2) {
            return 0.0;
        }
        double mx = mean(xs);
        double my = mean(ys);
        double sum = 0;
        for (int i = 0; i < xs.length; i++) {
            sum += (xs[i] - mx) * (ys[i] - my);
        }
        return sum / (xs.length - 1);
    }

    static double skew(double[] xs) {
        double m2 = centralMoment(xs, 2);
        return safe(centralMoment(xs, 3) / Math.pow(m2, 1.5));
    }

    /** Excess kurtosis. */
    static double kurtosis(double[] xs) {
        double m2 = centralMoment(xs, 2);
        return safe(centralMoment(xs, 4) / (m2 * m2) - 3.0);
    }

    private static double centralMoment(double[] xs, int order) {
        if (xs.length == 0) {
            return 0.0;
        }
        double m = mean(xs);
        double sum = 0;
        for (double x : xs) {
            sum += Math.pow(x - m, order);
        }
        return sum / xs.length;
    }

    static double cumulativeReturn(double[] returns) {
        double wealth = 1.0;
        for (double r : returns) {
            wealth *= 1.0 + r;
        }
        return wealth - 1.0;
    }

    /** Largest peak-to-trough decline of compounded wealth, as a non-positive fraction. */
    static double maxDrawdown(double[] returns) {
        double wealth = 1.0;
        double peak = 1.0;
        double worst = 0.0;
        for (double r : returns) {
            wealth *= 1.0 + r;
            peak = Math.max(peak, wealth);
            worst = Math.min(worst, wealth / peak - 1.0);
        }
        return worst;
    }

    static double downsideDeviation(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double r : returns) {
            double d = Math.min(r, 0.0);
            sum += d * d;
        }
        return Math.sqrt(sum / returns.length);
    }

    static double omega(double[] returns) {
        double gains = 0;
        double losses = 0;
        for (double r : returns) {
            if (r > 0) {
                gains += r;
            } else {
                losses -= r;
            }
        }
        return safe(gains / losses);
    }

    /** Linear-interpolated percentile, {@code p} in [0, 100]. */
    static double percentile(double[] xs, double p) {
        if (xs.length == 0) {
            return 0.0;
        }
        double[] sorted = xs.clone();
        Arrays.sort(sorted);
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
