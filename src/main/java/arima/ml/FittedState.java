package arima.ml;

import java.util.Arrays;

/**
 * Everything needed to forecast from a fitted model, and nothing more.
 * <p>
 * Immutable. A successful fit builds a new instance and the model swaps it in
 * with one reference assignment, so a reader never sees coefficients paired
 * with another fit's variance or history.
 */
public final class FittedState {

    private final OrderSpec order;
    private final Coefficients coefficients;
    private final double residualVariance;
    private final boolean converged;
    private final int evaluations;
    private final int observations;
    private final int exogWidth;
    private final double[] differencedTail; // last arLag values of the differenced series
    private final double[] residualTail;    // last maLag residuals
    private final double[] levelTail;       // last d + s*D original-scale values
    private final double[][] exogTail;      // last d + s*D original-scale regressor rows

    public FittedState(OrderSpec order, Coefficients coefficients, double residualVariance, boolean converged,
                       int evaluations, int observations, int exogWidth, double[] differencedTail,
                       double[] residualTail, double[] levelTail, double[][] exogTail) {
        this.order = order;
        this.coefficients = coefficients;
        this.residualVariance = residualVariance;
        this.converged = converged;
        this.evaluations = evaluations;
        this.observations = observations;
        this.exogWidth = exogWidth;
        this.differencedTail = differencedTail.clone();
        this.residualTail = residualTail.clone();
        this.levelTail = levelTail.clone();
        this.exogTail = copy(exogTail);
        checkConsistency();
    }

    /**
     * Verifies that every tail has the length the order requires.
     *
     * @throws IllegalArgumentException describing the first inconsistency found
     */
    void checkConsistency() {
        if (order == null || coefficients == null) {
            throw new IllegalArgumentException("Fitted state requires an order and coefficients");
        }
        order.validate();
        if (exogWidth < 0 || !coefficients.matches(order, exogWidth)) {
            throw new IllegalArgumentException("Coefficients do not match " + order + " with " + exogWidth + " regressors");
        }
        requireLength("differencedTail", differencedTail, order.arLag());
        requireLength("residualTail", residualTail, order.maLag());
        requireLength("levelTail", levelTail, order.integrationOrder());
        if (exogTail == null || exogTail.length != order.integrationOrder()) {
            throw new IllegalArgumentException("exogTail must have " + order.integrationOrder() + " rows");
        }
        for (double[] row : exogTail) {
            if (row == null || row.length != exogWidth) {
                throw new IllegalArgumentException("exogTail rows must have " + exogWidth + " columns");
            }
        }
        if (!(residualVariance > 0) || !Double.isFinite(residualVariance)) {
            throw new IllegalArgumentException("Residual variance must be finite and positive: " + residualVariance);
        }
    }

    private static void requireLength(String name, double[] values, int length) {
        if (values == null || values.length != length) {
            throw new IllegalArgumentException(name + " must have " + length + " values");
        }
    }

    private static double[][] copy(double[][] rows) {
        if (rows == null) return null;
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = rows[i] == null ? null : rows[i].clone();
        return out;
    }

    public OrderSpec getOrder() { return order; }
    public Coefficients getCoefficients() { return coefficients; }
    public double getResidualVariance() { return residualVariance; }
    public boolean isConverged() { return converged; }
    public int getEvaluations() { return evaluations; }
    public int getObservations() { return observations; }
    public int getExogWidth() { return exogWidth; }
    public double[] getDifferencedTail() { return differencedTail.clone(); }
    public double[] getResidualTail() { return residualTail.clone(); }
    public double[] getLevelTail() { return levelTail.clone(); }
    public double[][] getExogTail() { return copy(exogTail); }

    // unguarded views for ForecastEngine, which only reads them
    double[] differencedTail() { return differencedTail; }
    double[] residualTail() { return residualTail; }
    double[] levelTail() { return levelTail; }
    double[][] exogTail() { return exogTail; }

    @Override
    public String toString() {
        return "FittedState{" + order
            + ", " + coefficients
            + ", residualVariance=" + residualVariance
            + ", converged=" + converged
            + ", evaluations=" + evaluations
            + ", observations=" + observations
            + ", levelTail=" + Arrays.toString(levelTail) + '}';
    }
}
