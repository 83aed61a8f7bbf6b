package org.nowstart.scanner.repository;

import java.time.Instant;
import java.util.List;
import org.nowstart.scanner.data.type.Timeframe;
import org.nowstart.scanner.service.strategy.core.PriceBar;

/**
 * Source of historical bars. Implementations return bars oldest first and an empty list for unknown symbols.
 */
public interface MarketDataRepository {

    /**
     * Bars with {@code from <= timestamp < to}.
     */
    List<PriceBar> findBars(String symbol, Timeframe timeframe, Instant from, Instant to);

    List<PriceBar> findRecentBars(String symbol, Timeframe timeframe, int limit);
}
