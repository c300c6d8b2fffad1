package arima.ml;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterEstimatorTest {

    private static double[][] none(int n) {
        return new double[n][0];
    }

    @Test
    public void recoversAr1CoefficientByLeastSquares() {
        double[] y = SyntheticSeries.ar1(1000, 0, 0.5, 1.0, 42);

        ParameterEstimator.Estimate est = new ParameterEstimator().estimate(y, none(y.length), OrderSpec.autoregressive(1));

        assertEquals(0.5, est.getCoefficients().getAr()[0], 0.1);
        assertEquals(1.0, est.getResidualVariance(), 0.2);
        assertTrue(est.isConverged());
        assertEquals(0, est.getEvaluations());
    }

    @Test
    public void recoversMa1CoefficientWithNelderMead() {
        double[] y = SyntheticSeries.ma1(1000, 5, 0.6, 1.0, 7);

        ParameterEstimator.Estimate est = new ParameterEstimator().estimate(y, none(y.length), OrderSpec.movingAverage(1));

        assertEquals(0.6, est.getCoefficients().getMa()[0], 0.1);
        assertEquals(5, est.getCoefficients().getIntercept(), 0.2);
        assertEquals(1.0, est.getResidualVariance(), 0.2);
        assertTrue(est.isConverged());
        assertTrue(est.getEvaluations() > 0);
    }

    @Test
    public void recoversMa1CoefficientWithBobyqa() {
        double[] y = SyntheticSeries.ma1(1000, 5, 0.6, 1.0, 7);
        EstimatorSettings settings = EstimatorSettings.defaults().withOptimizer(EstimatorSettings.Optimizer.BOBYQA);

        ParameterEstimator.Estimate est = new ParameterEstimator(settings).estimate(y, none(y.length), OrderSpec.movingAverage(1));

        assertEquals(0.6, est.getCoefficients().getMa()[0], 0.1);
        assertEquals(5, est.getCoefficients().getIntercept(), 0.2);
    }

    @Test
    public void refinementNeverEndsWorseThanTheInitialGuess() {
        double[] y = SyntheticSeries.ma1(300, 0, -0.4, 1.0, 3);
        OrderSpec order = OrderSpec.arma(1, 1);

        ParameterEstimator.Estimate est = new ParameterEstimator().estimate(y, none(y.length), order);

        double[] init = new LinearRegression(
            DesignBuilder.build(y, none(y.length), order).getRows(),
            Arrays.copyOfRange(y, order.burnIn(), y.length)).getCoefficients();
        Coefficients start = new Coefficients(new double[] {init[1]}, new double[0],
            new double[] {ParameterEstimator.INITIAL_MA_COEFFICIENT}, new double[0], new double[0], init[0]);
        double startRss = InnovationEngine.sumOfSquares(start, order, y, none(y.length));
        double fittedRss = est.getResidualVariance() * (y.length - order.burnIn());
        assertTrue(fittedRss <= startRss, fittedRss + " > " + startRss);
    }

    @Test
    public void exhaustedBudgetKeepsBestVectorAndFlagsIt() {
        double[] y = SyntheticSeries.ma1(200, 0, 0.5, 1.0, 5);
        EstimatorSettings settings = EstimatorSettings.defaults().withMaxEvaluations(5);

        ParameterEstimator.Estimate est = new ParameterEstimator(settings).estimate(y, none(y.length), OrderSpec.movingAverage(1));

        assertFalse(est.isConverged());
        assertTrue(est.getEvaluations() > 0);
        assertTrue(est.getResidualVariance() > 0);
        assertTrue(Double.isFinite(est.getCoefficients().getMa()[0]));
    }

    @Test
    public void residualsAreZeroInsideBurnIn() {
        double[] y = SyntheticSeries.ar1(100, 1, 0.3, 1.0, 9);
        OrderSpec order = OrderSpec.sarima(1, 0, 0, 1, 0, 0, 4);

        double[] e = new ParameterEstimator().estimate(y, none(y.length), order).getResiduals();

        assertEquals(y.length, e.length);
        for (int t = 0; t < order.burnIn(); t++) assertEquals(0, e[t], 0);
    }

    @Test
    public void perfectFitIsDegenerate() {
        double[] y = new double[20];
        Arrays.fill(y, 2.5);
        assertThrows(DegenerateFitException.class,
            () -> new ParameterEstimator().estimate(y, none(y.length), OrderSpec.movingAverage(0)));
    }
}
