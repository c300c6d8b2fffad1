package arima.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ForecastEngineTest {

    private static final double[] NONE = new double[0];
    private static final double EPS = 1e-9;

    private static FittedState state(OrderSpec order, Coefficients coefs, int exogWidth, double[] zTail,
                                     double[] eTail, double[] levelTail, double[][] exogTail) {
        return new FittedState(order, coefs, 1.0, true, 0, 100, exogWidth, zTail, eTail, levelTail, exogTail);
    }

    private static FittedState ar1(double c, double phi, double last) {
        return state(OrderSpec.autoregressive(1), new Coefficients(new double[] {phi}, NONE, NONE, NONE, NONE, c),
            0, new double[] {last}, NONE, NONE, new double[0][]);
    }

    @Test
    public void autoregressiveStepsUsePreviousForecasts() {
        assertArrayEquals(new double[] {3, 2.5, 2.25}, ForecastEngine.forecast(ar1(1, 0.5, 4), 3, null), EPS);
    }

    @Test
    public void futureInnovationsAreZero() {
        FittedState state = state(OrderSpec.movingAverage(1),
            new Coefficients(NONE, NONE, new double[] {0.5}, NONE, NONE, 10),
            0, NONE, new double[] {2}, NONE, new double[0][]);
        assertArrayEquals(new double[] {11, 10, 10}, ForecastEngine.forecast(state, 3, null), EPS);
    }

    @Test
    public void seasonalArRepeatsTheLastSeason() {
        FittedState state = state(OrderSpec.sarima(0, 0, 0, 1, 0, 0, 4),
            new Coefficients(NONE, new double[] {1}, NONE, NONE, NONE, 0),
            0, new double[] {1, 2, 3, 4}, NONE, NONE, new double[0][]);
        assertArrayEquals(new double[] {1, 2, 3, 4, 1, 2}, ForecastEngine.forecast(state, 6, null), EPS);
    }

    @Test
    public void driftIsIntegratedBackToLevels() {
        FittedState state = state(OrderSpec.arima(0, 1, 0),
            new Coefficients(NONE, NONE, NONE, NONE, NONE, 2),
            0, NONE, NONE, new double[] {100}, new double[1][0]);
        assertArrayEquals(new double[] {102, 104, 106}, ForecastEngine.forecast(state, 3, null), EPS);
    }

    @Test
    public void seasonalDifferencingCarriesTheLastSeasonForward() {
        FittedState state = state(OrderSpec.sarima(0, 0, 0, 0, 1, 0, 4),
            new Coefficients(NONE, NONE, NONE, NONE, NONE, 0),
            0, NONE, NONE, new double[] {10, 20, 30, 40}, new double[4][0]);
        assertArrayEquals(new double[] {10, 20, 30, 40, 10}, ForecastEngine.forecast(state, 5, null), EPS);
    }

    @Test
    public void futureRegressorsAreDifferencedAfterTheRetainedTail() {
        FittedState state = state(OrderSpec.arima(0, 1, 0),
            new Coefficients(NONE, NONE, NONE, NONE, new double[] {2}, 0),
            1, NONE, NONE, new double[] {50}, new double[][] {{5}});
        assertArrayEquals(new double[] {52, 56}, ForecastEngine.forecast(state, 2, new double[][] {{6}, {8}}), EPS);
    }

    @Test
    public void stationaryForecastsDecayTowardTheProcessMean() {
        double c = 1;
        double phi = 0.8;
        double mean = c / (1 - phi);
        double[] f = ForecastEngine.forecast(ar1(c, phi, 15), 60, null);

        for (int i = 1; i < f.length; i++) {
            assertTrue(Math.abs(f[i] - mean) < Math.abs(f[i - 1] - mean));
        }
        assertEquals(mean, f[f.length - 1], 1e-3);
    }

    @Test
    public void forecastingLeavesStateUntouched() {
        FittedState state = ar1(1, 0.5, 4);
        ForecastEngine.forecast(state, 10, null);
        assertArrayEquals(new double[] {4}, state.getDifferencedTail(), 0);
    }

    @Test
    public void regressorShapeIsEnforced() {
        FittedState withX = state(OrderSpec.autoregressive(0),
            new Coefficients(NONE, NONE, NONE, NONE, new double[] {1}, 0),
            1, NONE, NONE, NONE, new double[0][]);
        assertThrows(RegressorShapeMismatchException.class, () -> ForecastEngine.forecast(withX, 2, null));
        assertThrows(RegressorShapeMismatchException.class,
            () -> ForecastEngine.forecast(withX, 5, new double[4][1]));
        assertThrows(RegressorShapeMismatchException.class,
            () -> ForecastEngine.forecast(withX, 2, new double[2][3]));
        assertArrayEquals(new double[] {1, 2}, ForecastEngine.forecast(withX, 2, new double[][] {{1}, {2}}), EPS);

        FittedState withoutX = ar1(0, 0.5, 1);
        assertThrows(RegressorShapeMismatchException.class,
            () -> ForecastEngine.forecast(withoutX, 2, new double[2][1]));
        assertEquals(2, ForecastEngine.forecast(withoutX, 2, new double[2][0]).length);
    }

    @Test
    public void horizonMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ForecastEngine.forecast(ar1(0, 0.5, 1), 0, null));
    }
}
