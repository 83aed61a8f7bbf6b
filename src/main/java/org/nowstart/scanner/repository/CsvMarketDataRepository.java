package org.nowstart.scanner.repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.nowstart.scanner.data.type.Timeframe;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.springframework.stereotype.Repository;

/**
 * Reads {@code <data-dir>/<SYMBOL>_<timeframe>.csv} files with a
 * {@code timestamp,open,high,low,close,volume} header and ISO-8601 instants.
 */
@Slf4j
@Repository
public class CsvMarketDataRepository implements MarketDataRepository {

    static final String HEADER = "timestamp,open,high,low,close,volume";

    private final Path dataDir;

    public CsvMarketDataRepository(ScannerProperties scannerProperties) {
        this.dataDir = Path.of(scannerProperties.dataDir()).toAbsolutePath().normalize();
    }

    @Override
    public List<PriceBar> findBars(String symbol, Timeframe timeframe, Instant from, Instant to) {
        return load(symbol, timeframe).stream()
                .filter(bar -> !bar.timestamp().isBefore(from) && bar.timestamp().isBefore(to))
                .toList();
    }

    @Override
    public List<PriceBar> findRecentBars(String symbol, Timeframe timeframe, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<PriceBar> bars = load(symbol, timeframe);
        return bars.subList(Math.max(0, bars.size() - limit), bars.size());
    }

    /**
     * @throws IllegalArgumentException when the symbol would resolve to a file outside the data directory
     */
    Path resolve(String symbol, Timeframe timeframe) {
        Path file = dataDir.resolve(symbol.trim().toUpperCase(Locale.ROOT) + "_" + timeframe.code() + ".csv").normalize();
        if (!file.startsWith(dataDir) || !dataDir.equals(file.getParent())) {
            throw new IllegalArgumentException("Symbol resolves outside the market data directory: " + symbol);
        }
        return file;
    }

    private List<PriceBar> load(String symbol, Timeframe timeframe) {
        Path file = resolve(symbol, timeframe);
        if (!Files.exists(file)) {
            log.debug("event=market_data_missing symbol={} timeframe={} file={}", symbol, timeframe.code(), file);
            return List.of();
        }

        String normalizedSymbol = symbol.trim().toUpperCase(Locale.ROOT);
        List<PriceBar> bars = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                return List.of();
            }
            if (!HEADER.equals(line.trim())) {
                throw new IllegalStateException("Unexpected CSV header in " + file + ": " + line);
            }
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    bars.add(parse(normalizedSymbol, line));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    skipped++;
                    log.warn("event=market_data_row_skipped file={} line={} reason=\"{}\"", file, lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        bars.sort(Comparator.comparing(PriceBar::timestamp));
        log.debug("event=market_data_loaded symbol={} timeframe={} bars={} skipped={}",
                normalizedSymbol, timeframe.code(), bars.size(), skipped);
        return bars;
    }

    private PriceBar parse(String symbol, String line) {
        String[] cols = line.split(",", -1);
        if (cols.length != 6) {
            throw new IllegalArgumentException("expected 6 columns, got " + cols.length);
        }
        return new PriceBar(
                symbol,
                Instant.parse(cols[0].trim()),
                Double.parseDouble(cols[1].trim()),
                Double.parseDouble(cols[2].trim()),
                Double.parseDouble(cols[3].trim()),
                Double.parseDouble(cols[4].trim()),
                Long.parseLong(cols[5].trim())
        );
    }
}
