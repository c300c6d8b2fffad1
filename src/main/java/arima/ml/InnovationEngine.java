package arima.ml;

/**
 * One-step-ahead innovations of a candidate model over a differenced series.
 * <p>
 * ẑ_t = c + Σ φ_i z_{t-i} + Σ Φ_i z_{t-i·s} + Σ θ_j e_{t-j} + Σ Θ_j e_{t-j·s} + Σ β_k x_{t,k}
 * and e_t = z_t - ẑ_t.
 * <p>
 * Conditional on zero pre-sample innovations: e_t = 0 for every t before the
 * burn-in index, and those positions stay out of the objective. This is an
 * approximation to the exact likelihood (no backcasting, no state-space
 * filter); it loses a little efficiency at the start of short series in
 * exchange for a single linear pass.
 */
public final class InnovationEngine {

    private InnovationEngine() {
    }

    /**
     * @param xDiff differenced regressor rows aligned with {@code z} (may be zero-width)
     * @return residuals, same length as {@code z}
     */
    public static double[] residuals(Coefficients coefs, OrderSpec order, double[] z, double[][] xDiff) {
        int s = order.getSeasonLength();
        double[] ar = coefs.ar();
        double[] sar = coefs.seasonalAr();
        double[] ma = coefs.ma();
        double[] sma = coefs.seasonalMa();
        double[] beta = coefs.exogenous();
        double c = coefs.getIntercept();

        double[] e = new double[z.length];
        for (int t = order.burnIn(); t < z.length; t++) {
            double pred = c;
            for (int i = 0; i < ar.length; i++) pred += ar[i] * z[t - 1 - i];
            for (int i = 0; i < sar.length; i++) pred += sar[i] * z[t - s * (i + 1)];
            for (int j = 0; j < ma.length; j++) pred += ma[j] * e[t - 1 - j];
            for (int j = 0; j < sma.length; j++) pred += sma[j] * e[t - s * (j + 1)];
            double[] x = xDiff[t];
            for (int k = 0; k < beta.length; k++) pred += beta[k] * x[k];
            e[t] = z[t] - pred;
        }
        return e;
    }

    /** Conditional sum of squares over the indices past the burn-in window. */
    public static double sumOfSquares(double[] residuals, int burnIn) {
        double rss = 0;
        for (int t = burnIn; t < residuals.length; t++) rss += residuals[t] * residuals[t];
        return rss;
    }

    public static double sumOfSquares(Coefficients coefs, OrderSpec order, double[] z, double[][] xDiff) {
        return sumOfSquares(residuals(coefs, order, z, xDiff), order.burnIn());
    }
}
