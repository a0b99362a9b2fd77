package com.coinbot.util;

import com.coinbot.model.Candle;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.List;

/**
 * Technical indicator math over closing-price series. All series are oldest first and
 * the returned arrays have the same length as the input; warm-up slots hold {@code NaN}.
 */
@UtilityClass
public class IndicatorUtils {

    public static double[] closes(List<Candle> candles) {
        double[] closes = new double[candles.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = candles.get(i).close();
        }
        return closes;
    }

    /**
     * Simple moving average over a sliding window of {@code period} values.
     */
    public static double[] sma(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential moving average with {@code alpha = 2 / (period + 1)}, seeded with the first value.
     */
    public static double[] ema(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        if (values.length == 0) {
            return out;
        }
        double alpha = 2.0 / (period + 1.0);
        double prev = values[0];
        out[0] = prev;
        for (int i = 1; i < values.length; i++) {
            prev += alpha * (values[i] - prev);
            out[i] = prev;
        }
        return out;
    }

    /**
     * RSI of the last value using simple averages of gains and losses over {@code period} deltas.
     *
     * @return RSI in [0, 100], or NaN when fewer than {@code period + 1} values are available
     */
    public static double rsi(double[] values, int period) {
        requirePeriod(period);
        if (values.length < period + 1) {
            return Double.NaN;
        }
        double gains = 0.0;
        double losses = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            double delta = values[i] - values[i - 1];
            if (delta > 0) {
                gains += delta;
            } else {
                losses -= delta;
            }
        }
        if (losses == 0.0) {
            return gains == 0.0 ? 50.0 : 100.0;
        }
        double rs = (gains / period) / (losses / period);
        return 100.0 - 100.0 / (1.0 + rs);
    }

    /**
     * MACD histogram series: (EMA fast - EMA slow) minus its EMA over {@code signalPeriod}.
     */
    public static double[] macdHistogram(double[] values, int fastPeriod, int slowPeriod, int signalPeriod) {
        double[] fast = ema(values, fastPeriod);
        double[] slow = ema(values, slowPeriod);
        double[] macd = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            macd[i] = fast[i] - slow[i];
        }
        double[] signal = ema(macd, signalPeriod);
        double[] histogram = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            histogram[i] = macd[i] - signal[i];
        }
        return histogram;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static void requirePeriod(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1, got " + period);
        }
    }
}
