package arima.ml;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Estimate (φ, Φ, θ, Θ, β, c) by conditional sum of squares.
 * <p>
 * Stage one regresses z_t on its AR and seasonal AR lags and the regressors
 * (OLS, Yule-Walker style); MA terms start at a small positive value. Without
 * MA terms that regression already minimizes the objective. Otherwise stage
 * two refines the whole vector with a derivative-free optimizer against the
 * residuals of {@link InnovationEngine}.
 * <p>
 * The search runs in a scaled space θ = θ₀ + scale·u so that coefficients,
 * the intercept and regressor weights move by comparable steps.
 */
public class ParameterEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterEstimator.class);

    static final double INITIAL_MA_COEFFICIENT = 0.1;
    private static final double ARMA_SCALE = 0.5;
    private static final double SIMPLEX_STEP = 0.2;
    private static final double BOBYQA_BOX = 3.0;
    private static final double BOBYQA_INITIAL_RADIUS = 0.5;
    private static final double BOBYQA_STOPPING_RADIUS = 1e-8;

    private final EstimatorSettings settings;

    public ParameterEstimator(EstimatorSettings settings) {
        this.settings = settings;
    }

    public ParameterEstimator() {
        this(EstimatorSettings.defaults());
    }

    /** Result of one estimation. */
    public static final class Estimate {

        private final Coefficients coefficients;
        private final double residualVariance;
        private final boolean converged;
        private final int evaluations;
        private final double[] residuals;

        Estimate(Coefficients coefficients, double residualVariance, boolean converged, int evaluations, double[] residuals) {
            this.coefficients = coefficients;
            this.residualVariance = residualVariance;
            this.converged = converged;
            this.evaluations = evaluations;
            this.residuals = residuals;
        }

        public Coefficients getCoefficients() { return coefficients; }
        public double getResidualVariance() { return residualVariance; }
        /** False when the evaluation budget ran out or the optimizer gave up; the best vector seen is kept. */
        public boolean isConverged() { return converged; }
        public int getEvaluations() { return evaluations; }
        /** Residuals over the whole differenced series, zero inside the burn-in window. */
        public double[] getResiduals() { return residuals.clone(); }
    }

    /**
     * @param z     differenced series
     * @param xDiff differenced regressor rows aligned with {@code z}, zero-width when there are none
     */
    public Estimate estimate(double[] z, double[][] xDiff, OrderSpec order) {
        int k = xDiff.length == 0 ? 0 : xDiff[0].length;
        DesignMatrix design = DesignBuilder.build(z, xDiff, order);
        double[] init = initialGuess(design, order, k);
        LOG.debug("Initial guess for {}: {}", order, Arrays.toString(init));

        Coefficients best;
        boolean converged = true;
        int evaluations = 0;
        if (order.getQ() + order.getSeasonalQ() == 0) {
            best = Coefficients.fromArray(order, k, init);
        } else {
            TrackedObjective objective = new TrackedObjective(order, k, z, xDiff, init, scales(design, order, k));
            converged = refine(objective);
            evaluations = objective.evaluations;
            if (objective.bestPoint == null) {
                throw new DegenerateFitException("Objective was non-finite at every one of "
                    + evaluations + " evaluations for " + order);
            }
            best = objective.coefficients(objective.bestPoint);
        }

        int burnIn = order.burnIn();
        double[] residuals = InnovationEngine.residuals(best, order, z, xDiff);
        double variance = InnovationEngine.sumOfSquares(residuals, burnIn) / (z.length - burnIn);
        if (!Double.isFinite(variance) || variance <= 0) {
            throw new DegenerateFitException("Residual variance " + variance + " for " + order
                + " is not a finite positive number");
        }
        return new Estimate(best, variance, converged, evaluations, residuals);
    }

    /** OLS on the static design: [φ, Φ, θ=0.1, Θ=0.1, β, c]. */
    private static double[] initialGuess(DesignMatrix design, OrderSpec order, int k) {
        LinearRegression lr = new LinearRegression(design.getRows(), design.getTargets());
        int arTerms = order.getP() + order.getSeasonalP();
        int maTerms = order.getQ() + order.getSeasonalQ();

        double[] params = new double[order.parameterCount(k)];
        int idx = 0;
        for (int i = 0; i < arTerms; i++) params[idx++] = lr.getCoefficient(i);
        for (int j = 0; j < maTerms; j++) params[idx++] = INITIAL_MA_COEFFICIENT;
        for (int i = 0; i < k; i++) params[idx++] = lr.getCoefficient(arTerms + i);
        params[idx] = lr.getIntercept();
        return params;
    }

    private static double[] scales(DesignMatrix design, OrderSpec order, int k) {
        int arTerms = order.getP() + order.getSeasonalP();
        int maTerms = order.getQ() + order.getSeasonalQ();
        double sdZ = positiveOr(new StandardDeviation().evaluate(design.getTargets()), 1.0);

        double[] scale = new double[order.parameterCount(k)];
        Arrays.fill(scale, 0, arTerms + maTerms, ARMA_SCALE);
        double[][] rows = design.getRows();
        for (int i = 0; i < k; i++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) column[r] = rows[r][arTerms + i];
            double sdX = new StandardDeviation().evaluate(column);
            scale[arTerms + maTerms + i] = sdX > 0 ? sdZ / sdX : sdZ;
        }
        scale[scale.length - 1] = sdZ;
        return scale;
    }

    private static double positiveOr(double value, double fallback) {
        return value > 0 && Double.isFinite(value) ? value : fallback;
    }

    /** @return whether the optimizer stopped on its own convergence criterion */
    private boolean refine(TrackedObjective objective) {
        int dim = objective.init.length;
        double[] start = new double[dim];
        objective.value(start);
        try {
            switch (settings.getOptimizer()) {
                case BOBYQA: {
                    double[] lower = new double[dim];
                    double[] upper = new double[dim];
                    Arrays.fill(lower, -BOBYQA_BOX);
                    Arrays.fill(upper, BOBYQA_BOX);
                    new BOBYQAOptimizer(2 * dim + 1, BOBYQA_INITIAL_RADIUS, BOBYQA_STOPPING_RADIUS).optimize(
                        new MaxEval(settings.getMaxEvaluations()),
                        new ObjectiveFunction(objective),
                        GoalType.MINIMIZE,
                        new InitialGuess(start),
                        new SimpleBounds(lower, upper));
                    break;
                }
                case NELDER_MEAD:
                default: {
                    double[] steps = new double[dim];
                    Arrays.fill(steps, SIMPLEX_STEP);
                    new SimplexOptimizer(settings.getRelativeTolerance(), settings.getAbsoluteTolerance()).optimize(
                        new MaxEval(settings.getMaxEvaluations()),
                        new ObjectiveFunction(objective),
                        GoalType.MINIMIZE,
                        new InitialGuess(start),
                        new NelderMeadSimplex(steps));
                    break;
                }
            }
            return true;
        } catch (TooManyEvaluationsException e) {
            LOG.warn("{} did not converge within {} evaluations for {}, keeping best objective {}",
                settings.getOptimizer(), settings.getMaxEvaluations(), objective.order, objective.bestValue);
            return false;
        } catch (MathIllegalStateException | MathArithmeticException | MathIllegalArgumentException e) {
            LOG.warn("{} stopped early for {} ({}), keeping best objective {}",
                settings.getOptimizer(), objective.order, e.getMessage(), objective.bestValue);
            return false;
        }
    }

    /** Conditional sum of squares in the scaled space, remembering the best finite point. */
    private static final class TrackedObjective implements MultivariateFunction {

        private final OrderSpec order;
        private final int k;
        private final double[] z;
        private final double[][] xDiff;
        private final double[] init;
        private final double[] scale;

        private double bestValue = Double.POSITIVE_INFINITY;
        private double[] bestPoint;
        private int evaluations;

        TrackedObjective(OrderSpec order, int k, double[] z, double[][] xDiff, double[] init, double[] scale) {
            this.order = order;
            this.k = k;
            this.z = z;
            this.xDiff = xDiff;
            this.init = init;
            this.scale = scale;
        }

        Coefficients coefficients(double[] u) {
            double[] theta = new double[init.length];
            for (int i = 0; i < theta.length; i++) theta[i] = init[i] + scale[i] * u[i];
            return Coefficients.fromArray(order, k, theta);
        }

        @Override
        public double value(double[] u) {
            evaluations++;
            double rss = InnovationEngine.sumOfSquares(coefficients(u), order, z, xDiff);
            if (!Double.isFinite(rss)) return Double.POSITIVE_INFINITY;
            if (rss < bestValue) {
                bestValue = rss;
                bestPoint = u.clone();
            }
            return rss;
        }
    }
}
