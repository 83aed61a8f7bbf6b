package org.nowstart.scanner.service.indicator;

import java.util.List;
import org.nowstart.scanner.data.exception.IndicatorCalculationException;
import org.nowstart.scanner.data.exception.InsufficientDataException;
import org.nowstart.scanner.service.strategy.core.IndicatorSnapshot;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.springframework.stereotype.Service;

/**
 * Stateless EMA/ATR calculations over price arrays ordered oldest first.
 */
@Service
public class IndicatorEngine {

    public static final int ATR_PERIOD = 14;
    public static final int LONGEST_EMA_PERIOD = 50;
    public static final int REQUIRED_DATA_POINTS = LONGEST_EMA_PERIOD + 1;

    public double ema(double[] values, int period) {
        if (values == null || period <= 0) {
            throw new IndicatorCalculationException("values and a positive period are required for EMA");
        }
        if (values.length < period) {
            throw new InsufficientDataException(
                    "Need at least " + period + " data points for EMA" + period + ", got " + values.length
            );
        }

        double result = exponentialMovingAverage(values, period);
        if (!Double.isFinite(result)) {
            throw new IndicatorCalculationException("Invalid EMA" + period + " result: " + result);
        }
        return result;
    }

    public double atr(double[] high, double[] low, double[] close, int period) {
        if (high == null || low == null || close == null || period <= 0) {
            throw new IndicatorCalculationException("high/low/close arrays and a positive period are required for ATR");
        }
        int required = period + 1;
        if (high.length < required || low.length < required || close.length < required) {
            throw new InsufficientDataException("Need at least " + required + " data points for ATR" + period);
        }
        if (high.length != low.length || low.length != close.length) {
            throw new IndicatorCalculationException("high, low, and close arrays must have the same length");
        }

        double[] trueRange = new double[close.length - 1];
        for (int i = 1; i < close.length; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            trueRange[i - 1] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double result = exponentialMovingAverage(trueRange, period);
        if (!Double.isFinite(result) || result < 0.0) {
            throw new IndicatorCalculationException("Invalid ATR" + period + " result: " + result);
        }
        return result;
    }

    public AtrBands atrBands(double close, double atr, double multiplier) {
        if (!(close > 0.0) || !(atr >= 0.0) || !(multiplier > 0.0)) {
            throw new IndicatorCalculationException(
                    "ATR bands need close > 0, atr >= 0, multiplier > 0 (close=" + close + ", atr=" + atr
                            + ", multiplier=" + multiplier + ")"
            );
        }
        double offset = atr * multiplier;
        return new AtrBands(close - offset, close + offset);
    }

    public void validateDataSufficiency(int dataLength) {
        if (dataLength < REQUIRED_DATA_POINTS) {
            throw new InsufficientDataException(
                    "Need at least " + REQUIRED_DATA_POINTS + " data points for all indicators, got " + dataLength
            );
        }
    }

    /**
     * Computes every indicator for the last element of the arrays.
     *
     * <p>Lengths and sufficiency are checked for all indicators up front, so a failure never leaves a
     * partially computed snapshot behind.
     *
     * @throws InsufficientDataException     when fewer than {@link #REQUIRED_DATA_POINTS} values are given
     * @throws IndicatorCalculationException when inputs are misaligned or a result is not a finite number
     */
    public IndicatorSnapshot computeIndicators(double[] high, double[] low, double[] close, double atrMultiplier) {
        if (high == null || low == null || close == null) {
            throw new IndicatorCalculationException("high/low/close arrays are required");
        }
        if (high.length != low.length || low.length != close.length) {
            throw new IndicatorCalculationException("Price arrays must have the same length");
        }
        validateDataSufficiency(close.length);

        double ema5 = ema(close, 5);
        double ema8 = ema(close, 8);
        double ema13 = ema(close, 13);
        double ema21 = ema(close, 21);
        double ema50 = ema(close, LONGEST_EMA_PERIOD);
        double atr = atr(high, low, close, ATR_PERIOD);
        AtrBands bands = atrBands(close[close.length - 1], atr, atrMultiplier);

        return new IndicatorSnapshot(ema5, ema8, ema13, ema21, ema50, atr, bands.longLine(), bands.shortLine());
    }

    public IndicatorSnapshot computeIndicators(List<PriceBar> bars, double atrMultiplier) {
        int n = bars.size();
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            PriceBar bar = bars.get(i);
            high[i] = bar.high();
            low[i] = bar.low();
            close[i] = bar.close();
        }
        return computeIndicators(high, low, close, atrMultiplier);
    }

    private double exponentialMovingAverage(double[] values, int length) {
        double alpha = 2.0 / (length + 1.0);
        double ema = values[0];
        for (int i = 1; i < values.length; i++) {
            ema = (alpha * values[i]) + ((1.0 - alpha) * ema);
        }
        return ema;
    }

    public record AtrBands(double longLine, double shortLine) {
    }
}
