package arima.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Seasonal ARIMA with optional exogenous regressors (SARIMAX).
 * <p>
 * Model: SARIMA(p,d,q)(P,D,Q)s
 * ∇^d ∇_s^D y_t = c + Σ φ_i z_{t-i} + Σ Φ_i z_{t-i·s} + Σ θ_j ε_{t-j} + Σ Θ_j ε_{t-j·s} + β'x_t + ε_t
 * where z is the differenced series and x the regressors differenced the same way.
 * <p>
 * A model starts unfit. {@link #fit} estimates the coefficients and publishes a
 * new {@link FittedState}; {@link #predict} only reads that state, so it can be
 * called any number of times, from any thread. Concurrent {@code fit} calls on
 * one instance must be serialized by the caller.
 */
public class ArimaModel {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaModel.class);

    private final OrderSpec order;
    private final ParameterEstimator estimator;
    private volatile FittedState state;

    public ArimaModel(OrderSpec order, EstimatorSettings settings) {
        if (order == null) throw new IllegalArgumentException("order required");
        this.order = order;
        this.estimator = new ParameterEstimator(settings);
    }

    public ArimaModel(OrderSpec order) {
        this(order, EstimatorSettings.defaults());
    }

    /**
     * SARIMA(p,d,q)(P,D,Q)s.
     * Typical for monthly data with yearly seasonality: s=12, e.g. (1,0,1)(1,0,1)12.
     */
    public static ArimaModel sarima(int p, int d, int q, int P, int D, int Q, int s) {
        return new ArimaModel(OrderSpec.sarima(p, d, q, P, D, Q, s));
    }

    public static ArimaModel arima(int p, int d, int q) {
        return new ArimaModel(OrderSpec.arima(p, d, q));
    }

    public static ArimaModel arma(int p, int q) {
        return new ArimaModel(OrderSpec.arma(p, q));
    }

    public static ArimaModel autoregressive(int p) {
        return new ArimaModel(OrderSpec.autoregressive(p));
    }

    public static ArimaModel movingAverage(int q) {
        return new ArimaModel(OrderSpec.movingAverage(q));
    }

    /** A fit model around a previously saved state. */
    public static ArimaModel restored(FittedState state, EstimatorSettings settings) {
        ArimaModel model = new ArimaModel(state.getOrder(), settings);
        model.restore(state);
        return model;
    }

    public ArimaModel fit(double[] y) {
        return fit(y, null);
    }

    /**
     * Estimate the model on {@code y} with optional regressors {@code x}.
     * On failure the previous fitted state, if any, is left in place.
     *
     * @param y training series
     * @param x one regressor row per element of {@code y}, or {@code null}
     */
    public ArimaModel fit(double[] y, double[][] x) {
        if (y == null || y.length == 0) throw new IllegalArgumentException("y must be non-null and non-empty");
        double[][] rows = regressorRows(x, y.length);
        if (y.length < order.minimumObservations()) {
            throw new InsufficientHistoryException("y of length " + y.length + " is not long enough for "
                + order + "; at least " + order.minimumObservations() + " observations are required");
        }
        int d = order.getD();
        int D = order.getSeasonalD();
        int s = order.getSeasonLength();
        double[] z = Differencer.difference(y, d, D, s);
        double[][] xDiff = Differencer.difference(rows, d, D, s);

        ParameterEstimator.Estimate estimate = estimator.estimate(z, xDiff, order);
        int k = rows[0].length;
        int keep = order.integrationOrder();
        FittedState next = new FittedState(
            order,
            estimate.getCoefficients(),
            estimate.getResidualVariance(),
            estimate.isConverged(),
            estimate.getEvaluations(),
            y.length,
            k,
            tail(z, order.arLag()),
            tail(estimate.getResiduals(), order.maLag()),
            tail(y, keep),
            Arrays.copyOfRange(rows, rows.length - keep, rows.length));
        this.state = next;
        LOG.info("Fitted {} on {} observations: sigma2={}, converged={}, evaluations={}",
            order, y.length, next.getResidualVariance(), next.isConverged(), next.getEvaluations());
        return this;
    }

    public double[] predict(int h) {
        return predict(h, null);
    }

    /**
     * Forecast the next {@code h} values on the original scale.
     *
     * @param x h future regressor rows, required when the model was fit with regressors
     */
    public double[] predict(int h, double[][] x) {
        FittedState current = state;
        if (current == null) throw new ModelNotFitException();
        return ForecastEngine.forecast(current, h, x);
    }

    /** Fit on {@code y} and {@code x}, then forecast {@code h} steps with {@code xFuture}. */
    public double[] forecast(double[] y, int h, double[][] x, double[][] xFuture) {
        return fit(y, x).predict(h, xFuture);
    }

    /** Install a saved state; its order must be this model's order. */
    public void restore(FittedState saved) {
        if (saved == null) throw new IllegalArgumentException("state required");
        if (!order.equals(saved.getOrder())) {
            throw new IllegalArgumentException("State was fit for " + saved.getOrder() + ", model is " + order);
        }
        this.state = saved;
    }

    public boolean isFit() {
        return state != null;
    }

    /** @throws ModelNotFitException before the first successful fit */
    public FittedState getFittedState() {
        FittedState current = state;
        if (current == null) throw new ModelNotFitException();
        return current;
    }

    public OrderSpec getOrder() {
        return order;
    }

    /** Regressor rows of length {@code n}, zero-width when {@code x} is null. */
    private static double[][] regressorRows(double[][] x, int n) {
        if (x == null) return new double[n][0];
        if (x.length != n) {
            throw new RegressorShapeMismatchException("x is length: " + x.length + ". It should be length: " + n + ".");
        }
        int width = x[0] == null ? -1 : x[0].length;
        for (double[] row : x) {
            if (row == null || row.length != width) {
                throw new RegressorShapeMismatchException("All regressor rows must have the same number of columns");
            }
        }
        return x;
    }

    private static double[] tail(double[] values, int length) {
        return Arrays.copyOfRange(values, values.length - length, values.length);
    }
}
