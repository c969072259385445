package com.hypecycle.core.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Market signals from Yahoo Finance.
 * <p>
 * Tickers are discovered with Yahoo's symbol search for the keyword; when nothing matches,
 * broad technology ETFs stand in. Two years of daily closes per ticker yield price changes,
 * volume and annualized volatility. Finance is never re-queried with expansion terms.
 */
@Component
public class FinanceCollector extends AbstractHttpCollector {

    static final List<String> FALLBACK_TICKERS = List.of("QQQ", "XLK");
    static final int MAX_TICKERS = 8;
    static final int TRADING_DAYS_1M = 21;
    static final int TRADING_DAYS_6M = 126;
    private static final Pattern TICKER = Pattern.compile("^[A-Z]{1,5}$");

    public FinanceCollector(HttpClient collectorHttpClient, ObjectMapper objectMapper,
                            CollectorProperties properties, Clock clock) {
        super(collectorHttpClient, objectMapper, properties, clock);
    }

    @Override
    public SourceName source() {
        return SourceName.FINANCE;
    }

    @Override
    public CollectorOutcome fetch(String keyword, List<String> expansionTerms) {
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();

        List<String> tickers = discoverTickers(keyword, errors);
        List<TickerStats> stats = new ArrayList<>();
        for (String ticker : tickers) {
            TickerStats tickerStats = fetchTicker(ticker, errors);
            if (tickerStats != null) {
                stats.add(tickerStats);
            }
        }
        if (stats.isEmpty()) {
            return allRequestsFailed(errors);
        }

        double change1m = stats.stream().mapToDouble(TickerStats::change1m).average().orElse(0);
        double change6m = stats.stream().mapToDouble(TickerStats::change6m).average().orElse(0);
        double change2y = stats.stream().mapToDouble(TickerStats::change2y).average().orElse(0);
        double volume1m = stats.stream().mapToDouble(TickerStats::volume1m).average().orElse(0);
        double volume6m = stats.stream().mapToDouble(TickerStats::volume6m).average().orElse(0);
        double volatility1m = stats.stream().mapToDouble(TickerStats::volatility1m).average().orElse(0);
        double volatility6m = stats.stream().mapToDouble(TickerStats::volatility6m).average().orElse(0);

        Map<String, Object> extra = orderedMap();
        extra.put("companies_found", stats.size());
        extra.put("tickers", stats.stream().map(TickerStats::ticker).toList());
        extra.put("avg_price_change_1m", round(change1m, 4));
        extra.put("avg_price_change_6m", round(change6m, 4));
        extra.put("avg_price_change_2y", round(change2y, 4));
        extra.put("avg_volume_1m", round(volume1m, 0));
        extra.put("avg_volume_6m", round(volume6m, 0));
        extra.put("volume_trend", volumeTrend(volume1m, volume6m));
        extra.put("avg_volatility_1m", round(volatility1m, 4));
        extra.put("avg_volatility_6m", round(volatility6m, 4));
        extra.put("market_maturity", marketMaturity(stats.size(), volatility6m));
        extra.put("investor_sentiment", investorSentiment(change1m, change6m));
        extra.put("investment_momentum", investmentMomentum(change1m, change6m, change2y));

        return CollectorOutcome.ok(new SourceMetrics(SourceName.FINANCE, keyword, now,
                stats.size(), stats.size(), extra, errors));
    }

    private List<String> discoverTickers(String keyword, List<String> errors) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", keyword);
        params.put("quotesCount", "10");
        params.put("newsCount", "0");
        var body = getJson(properties.getFinanceSearchUrl(), params, Map.of(), errors);

        List<String> tickers = new ArrayList<>();
        if (body.isPresent()) {
            for (JsonNode quote : body.get().path("quotes")) {
                String type = quote.path("quoteType").asText("");
                String symbol = quote.path("symbol").asText("").toUpperCase();
                if (("EQUITY".equals(type) || "ETF".equals(type))
                        && TICKER.matcher(symbol).matches()
                        && !tickers.contains(symbol)) {
                    tickers.add(symbol);
                }
                if (tickers.size() == MAX_TICKERS) {
                    break;
                }
            }
        }
        if (tickers.isEmpty()) {
            errors.add("No matching tickers, using fallback ETFs");
            return FALLBACK_TICKERS;
        }
        return tickers;
    }

    private TickerStats fetchTicker(String ticker, List<String> errors) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("range", "2y");
        params.put("interval", "1d");
        var body = getJson(properties.getFinanceChartUrl() + encode(ticker), params, Map.of(), errors);
        if (body.isEmpty()) {
            return null;
        }
        JsonNode quote = body.get().path("chart").path("result").path(0).path("indicators").path("quote").path(0);
        List<Double> closes = new ArrayList<>();
        List<Double> volumes = new ArrayList<>();
        JsonNode closeNode = quote.path("close");
        JsonNode volumeNode = quote.path("volume");
        for (int i = 0; i < closeNode.size(); i++) {
            if (!closeNode.get(i).isNull()) {
                closes.add(closeNode.get(i).asDouble());
                volumes.add(volumeNode.path(i).asDouble(0));
            }
        }
        if (closes.size() < 2) {
            errors.add("No data for " + ticker);
            return null;
        }
        return new TickerStats(ticker,
                priceChange(tail(closes, TRADING_DAYS_1M)),
                priceChange(tail(closes, TRADING_DAYS_6M)),
                priceChange(closes),
                mean(tail(volumes, TRADING_DAYS_1M)),
                mean(tail(volumes, TRADING_DAYS_6M)),
                volatility(tail(closes, TRADING_DAYS_1M)),
                volatility(tail(closes, TRADING_DAYS_6M)));
    }

    private static List<Double> tail(List<Double> values, int count) {
        return values.subList(Math.max(0, values.size() - count), values.size());
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    /** Fractional change from first to last close. */
    static double priceChange(List<Double> closes) {
        if (closes.size() < 2 || closes.get(0) == 0) {
            return 0.0;
        }
        return (closes.get(closes.size() - 1) - closes.get(0)) / closes.get(0);
    }

    /** Annualized standard deviation of daily returns. */
    static double volatility(List<Double> closes) {
        if (closes.size() < 3) {
            return 0.0;
        }
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < closes.size(); i++) {
            if (closes.get(i - 1) != 0) {
                returns.add(closes.get(i) / closes.get(i - 1) - 1);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).sum() / (returns.size() - 1);
        return Math.sqrt(variance) * Math.sqrt(252);
    }

    static String volumeTrend(double volume1m, double volume6m) {
        if (volume6m == 0) {
            return "stable";
        }
        double change = (volume1m - volume6m) / volume6m;
        if (change > 0.15) {
            return "increasing";
        }
        return change < -0.15 ? "decreasing" : "stable";
    }

    static String marketMaturity(int companies, double volatility6m) {
        if (companies >= 5 && volatility6m < 0.3) {
            return "mature";
        }
        if (companies < 3 || volatility6m > 0.6) {
            return "emerging";
        }
        return "developing";
    }

    static String investorSentiment(double change1m, double change6m) {
        double weighted = change1m * 0.6 + change6m * 0.4;
        if (weighted > 0.05) {
            return "positive";
        }
        return weighted < -0.05 ? "negative" : "neutral";
    }

    static String investmentMomentum(double change1m, double change6m, double change2y) {
        if (change1m > change6m && change6m > change2y / 4) {
            return "accelerating";
        }
        if (change1m < change6m / 2 || (change1m < 0 && change6m > 0)) {
            return "decelerating";
        }
        return "steady";
    }

    private record TickerStats(String ticker, double change1m, double change6m, double change2y,
                               double volume1m, double volume6m, double volatility1m, double volatility6m) {}
}
