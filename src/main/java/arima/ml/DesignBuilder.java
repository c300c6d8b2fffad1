package arima.ml;

/**
 * Builds the lagged-regressor rows used to initialize the estimator.
 * <p>
 * For every t ≥ burn-in the row is [z_{t-1}..z_{t-p}, z_{t-s}..z_{t-P·s}, x_t]
 * with target z_t. Earlier indices are dropped rather than zero-filled. MA
 * terms depend on residuals and are not part of this matrix.
 */
public final class DesignBuilder {

    private DesignBuilder() {
    }

    /**
     * @param z     differenced series
     * @param xDiff differenced regressor rows, one per element of {@code z} (may be zero-width)
     */
    public static DesignMatrix build(double[] z, double[][] xDiff, OrderSpec order) {
        if (xDiff.length != z.length) {
            throw new RegressorShapeMismatchException("Regressors have " + xDiff.length
                + " rows, differenced series has " + z.length);
        }
        int start = order.burnIn();
        if (start >= z.length) {
            throw new InsufficientHistoryException("Differenced series of length " + z.length
                + " leaves no estimation residual for " + order + " (burn-in " + start + ")");
        }
        int p = order.getP();
        int P = order.getSeasonalP();
        int s = order.getSeasonLength();
        int k = xDiff.length == 0 ? 0 : xDiff[0].length;

        int n = z.length - start;
        double[][] rows = new double[n][p + P + k];
        double[] targets = new double[n];
        for (int t = start; t < z.length; t++) {
            double[] row = rows[t - start];
            int col = 0;
            for (int i = 1; i <= p; i++) row[col++] = z[t - i];
            for (int i = 1; i <= P; i++) row[col++] = z[t - i * s];
            System.arraycopy(xDiff[t], 0, row, col, k);
            targets[t - start] = z[t];
        }
        return new DesignMatrix(rows, targets, start);
    }
}
