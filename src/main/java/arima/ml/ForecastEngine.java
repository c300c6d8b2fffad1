package arima.ml;

import java.util.Arrays;

/**
 * Recursive h-step forecasts from a {@link FittedState}.
 * <p>
 * Steps are produced on the differenced scale in time order. A lag that falls
 * inside the retained history reads the observed value or residual; past the
 * end of the history AR lags read earlier forecasts and MA lags read zero,
 * the expectation of an unknown innovation. The result is integrated back to
 * the original scale. The state is only read.
 */
public final class ForecastEngine {

    private ForecastEngine() {
    }

    /**
     * @param futureRegressors h rows of regressors, original scale; {@code null} when the model has none
     */
    public static double[] forecast(FittedState state, int h, double[][] futureRegressors) {
        if (h < 1) throw new IllegalArgumentException("Forecast horizon must be positive: " + h);
        OrderSpec order = state.getOrder();
        double[][] xDiff = differencedFutureRegressors(state, h, futureRegressors);

        Coefficients coefs = state.getCoefficients();
        int s = order.getSeasonLength();
        double[] ar = coefs.ar();
        double[] sar = coefs.seasonalAr();
        double[] ma = coefs.ma();
        double[] sma = coefs.seasonalMa();
        double[] beta = coefs.exogenous();

        // history followed by the forecast slots; future innovations stay at zero
        double[] zHist = state.differencedTail();
        double[] eHist = state.residualTail();
        double[] z = Arrays.copyOf(zHist, zHist.length + h);
        double[] e = Arrays.copyOf(eHist, eHist.length + h);
        int zStart = zHist.length;
        int eStart = eHist.length;

        for (int step = 0; step < h; step++) {
            int tz = zStart + step;
            int te = eStart + step;
            double pred = coefs.getIntercept();
            for (int i = 0; i < ar.length; i++) pred += ar[i] * z[tz - 1 - i];
            for (int i = 0; i < sar.length; i++) pred += sar[i] * z[tz - s * (i + 1)];
            for (int j = 0; j < ma.length; j++) pred += ma[j] * e[te - 1 - j];
            for (int j = 0; j < sma.length; j++) pred += sma[j] * e[te - s * (j + 1)];
            for (int k = 0; k < beta.length; k++) pred += beta[k] * xDiff[step][k];
            z[tz] = pred;
        }

        double[] differenced = Arrays.copyOfRange(z, zStart, zStart + h);
        return Differencer.integrate(differenced, state.levelTail(),
            order.getD(), order.getSeasonalD(), s);
    }

    /** Validates the future rows and differences them after the retained raw regressor tail. */
    private static double[][] differencedFutureRegressors(FittedState state, int h, double[][] future) {
        int k = state.getExogWidth();
        if (future == null) {
            if (k > 0) {
                throw new RegressorShapeMismatchException("Model was fit with " + k
                    + " regressors; " + h + " future rows are required");
            }
            return new double[h][0];
        }
        if (future.length != h) {
            throw new RegressorShapeMismatchException("Got " + future.length
                + " future regressor rows for a horizon of " + h);
        }
        for (double[] row : future) {
            if (row == null || row.length != k) {
                throw new RegressorShapeMismatchException("Future regressor rows must have " + k + " columns");
            }
        }
        if (k == 0) return new double[h][0];

        OrderSpec order = state.getOrder();
        double[][] tail = state.exogTail();
        double[][] raw = new double[tail.length + h][];
        System.arraycopy(tail, 0, raw, 0, tail.length);
        System.arraycopy(future, 0, raw, tail.length, h);
        return Differencer.difference(raw, order.getD(), order.getSeasonalD(), order.getSeasonLength());
    }
}
