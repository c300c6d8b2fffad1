package arima.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordinary Least Squares (OLS) with an intercept, used to seed the estimator.
 * <p>
 * Model: y = β₀ + β₁x₁ + β₂x₂ + ... + βₙxₙ
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y, where X carries a
 * leading column of 1s. Rank-deficient designs (collinear lags, constant
 * regressors, fewer rows than columns) fall back to the minimum-norm
 * pseudo-inverse solution.
 */
public class LinearRegression {

    private static final Logger LOG = LoggerFactory.getLogger(LinearRegression.class);

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final boolean fullRank;
    private final double residualSumOfSquares;

    /**
     * @param X design matrix (rows = observations, columns = features; no intercept column)
     * @param y response vector (length = number of observations)
     */
    public LinearRegression(double[][] X, double[] y) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        int n = X.length;
        int features = X[0].length;
        int p = features + 1;

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(X[i], 0, design[i], 1, features);
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);
        RealMatrix Xt = Xm.transpose();

        DecompositionSolver solver = new LUDecomposition(Xt.multiply(Xm)).getSolver();
        if (solver.isNonSingular()) {
            coefficients = solver.solve(Xt.operate(yv)).toArray();
            fullRank = true;
        } else {
            LOG.debug("X'X is singular for {} rows x {} columns, using the pseudo-inverse", n, p);
            coefficients = new SingularValueDecomposition(Xm).getSolver().solve(yv).toArray();
            fullRank = false;
        }

        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double r = y[i] - predict(X[i]);
            ssRes += r * r;
        }
        residualSumOfSquares = ssRes;
    }

    /** Intercept β₀ */
    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient βᵢ for feature i (0-based). β₁ is first feature. */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    /** All coefficients [β₀, β₁, ..., βₙ] */
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public boolean isFullRank() { return fullRank; }
    public double getResidualSumOfSquares() { return residualSumOfSquares; }

    /** Predict y for one observation (no intercept in x). */
    public double predict(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }
}
