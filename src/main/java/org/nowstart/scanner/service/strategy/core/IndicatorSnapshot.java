package org.nowstart.scanner.service.strategy.core;

/**
 * Indicator values for one bar, computed from that bar and everything before it.
 *
 * @param atrLongLine  close minus ATR times the configured multiplier
 * @param atrShortLine close plus ATR times the configured multiplier
 */
public record IndicatorSnapshot(
        double ema5,
        double ema8,
        double ema13,
        double ema21,
        double ema50,
        double atr,
        double atrLongLine,
        double atrShortLine
) {
}
