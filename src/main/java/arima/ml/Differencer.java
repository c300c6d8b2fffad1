package arima.ml;

import java.util.Arrays;

/**
 * Non-seasonal and seasonal differencing, and its inverse.
 * <p>
 * ∇^d ∇_s^D y_t: d first differences (y_t - y_{t-1}) followed by D seasonal
 * differences (y_t - y_{t-s}).
 */
public final class Differencer {

    private Differencer() {
    }

    /** Apply non-seasonal differencing d times and seasonal differencing D times (lag s). */
    public static double[] difference(double[] series, int d, int D, int s) {
        int consumed = d + s * D;
        if (series.length < consumed + 1) {
            throw new InsufficientHistoryException("Series of length " + series.length
                + " cannot be differenced with d=" + d + ", D=" + D + ", s=" + s
                + "; at least " + (consumed + 1) + " values are required");
        }
        return applyDifferences(series, d, D, s);
    }

    /** Column-wise {@link #difference(double[], int, int, int)} of regressor rows. */
    public static double[][] difference(double[][] rows, int d, int D, int s) {
        int consumed = d + s * D;
        if (rows.length < consumed + 1) {
            throw new InsufficientHistoryException("Regressors with " + rows.length
                + " rows cannot be differenced with d=" + d + ", D=" + D + ", s=" + s);
        }
        double[][] z = rows;
        for (int i = 0; i < d; i++) {
            z = diff(z, 1);
        }
        for (int i = 0; i < D; i++) {
            z = diff(z, s);
        }
        return z == rows ? deepCopy(rows) : z;
    }

    /**
     * Bring differenced forecasts back to the original scale.
     * <p>
     * Undoes the seasonal differences first and the non-seasonal ones last, each
     * level seeded with the trailing values of {@code history} at that level.
     *
     * @param differenced forecasts on the differenced scale, in time order
     * @param history     original-scale observations immediately preceding the forecasts
     */
    public static double[] integrate(double[] differenced, double[] history, int d, int D, int s) {
        if (d == 0 && D == 0) return differenced.clone();
        int consumed = d + s * D;
        if (history.length < consumed) {
            throw new InsufficientHistoryException("Integration with d=" + d + ", D=" + D + ", s=" + s
                + " needs " + consumed + " trailing values, got " + history.length);
        }
        double[] level = differenced.clone();
        for (int i = D - 1; i >= 0; i--) {
            level = undiff(level, applyDifferences(history, d, i, s), s);
        }
        for (int i = d - 1; i >= 0; i--) {
            level = undiff(level, applyDifferences(history, i, 0, s), 1);
        }
        return level;
    }

    private static double[] applyDifferences(double[] series, int d, int D, int s) {
        double[] z = series.clone();
        for (int i = 0; i < d; i++) {
            z = diff(z, 1);
        }
        for (int i = 0; i < D; i++) {
            z = diff(z, s);
        }
        return z;
    }

    private static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    private static double[][] diff(double[][] x, int lag) {
        if (lag >= x.length) return new double[0][];
        double[][] out = new double[x.length - lag][];
        for (int i = lag; i < x.length; i++) {
            double[] row = new double[x[i].length];
            for (int c = 0; c < row.length; c++) {
                row[c] = x[i][c] - x[i - lag][c];
            }
            out[i - lag] = row;
        }
        return out;
    }

    /** Cumulative sum at {@code lag}, seeded with the last {@code lag} values of {@code level}. */
    private static double[] undiff(double[] values, double[] level, int lag) {
        double[] z = new double[lag + values.length];
        System.arraycopy(level, level.length - lag, z, 0, lag);
        System.arraycopy(values, 0, z, lag, values.length);
        for (int t = lag; t < z.length; t++) {
            z[t] += z[t - lag];
        }
        return Arrays.copyOfRange(z, lag, z.length);
    }

    private static double[][] deepCopy(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = rows[i].clone();
        return out;
    }
}
