package arima.ml;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class DifferencerTest {

    private static final double EPS = 1e-9;

    @Test
    public void zeroOrderIsIdentity() {
        double[] y = {1, 2, 3, 4, 5};
        assertArrayEquals(y, Differencer.difference(y, 0, 0, 0), EPS);
        assertArrayEquals(y, Differencer.integrate(y, new double[0], 0, 0, 0), EPS);
    }

    @Test
    public void firstSecondAndThirdDifferences() {
        assertArrayEquals(new double[] {1, 1, 1, 1},
            Differencer.difference(new double[] {1, 2, 3, 4, 5}, 1, 0, 0), EPS);
        assertArrayEquals(new double[] {1, 1, 1, 1, 1},
            Differencer.difference(new double[] {1, 2, 4, 7, 11, 16, 22}, 2, 0, 0), EPS);
        assertArrayEquals(new double[] {1, 1, 1, 1},
            Differencer.difference(new double[] {1, 2, 4, 8, 15, 26, 42}, 3, 0, 0), EPS);
    }

    @Test
    public void seasonalDifferenceRemovesRepeatingPattern() {
        double[] y = {7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6};
        assertArrayEquals(new double[y.length - 7], Differencer.difference(y, 0, 1, 7), EPS);
    }

    @Test
    public void firstThenSeasonalDifference() {
        double[] y = new double[12];
        for (int i = 0; i < y.length; i++) y[i] = (i + 1) + (i / 3 + 1);
        assertArrayEquals(new double[8], Differencer.difference(y, 1, 1, 3), EPS);
    }

    @Test
    public void integrateInvertsFirstDifferences() {
        double[] y = new double[50];
        for (int i = 0; i < y.length; i++) y[i] = 2 * i;
        assertRoundTrip(y, 14, 1, 0, 0);
    }

    @Test
    public void integrateInvertsSecondDifferences() {
        double[] y = {1, 2, 4, 7, 11, 16, 22, 29, 37, 46, 56, 67, 79, 92, 106, 121, 137, 154, 172};
        assertRoundTrip(y, 14, 2, 0, 0);
    }

    @Test
    public void integrateInvertsMixedDifferences() {
        double[] trend = {1, 2, 4, 7, 11, 16, 22, 29, 37, 46, 56, 67, 79, 92, 106, 121, 137, 154, 172};
        double[] y = new double[trend.length];
        for (int i = 0; i < y.length; i++) y[i] = trend[i] + (i % 2 == 0 ? 1 : 4);
        assertRoundTrip(y, 14, 2, 1, 2);
    }

    @Test
    public void integrateInvertsSeasonalDifferences() {
        double[] y = {7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6, 7, 6, 4, 3, 4, 5, 6};
        assertRoundTrip(y, 14, 0, 1, 7);
    }

    @Test
    public void integrateInvertsArbitrarySeries() {
        double[] y = SyntheticSeries.gaussian(60, 3, 2, 11);
        assertRoundTrip(y, 40, 1, 2, 5);
    }

    @Test
    public void shortSeriesIsRejected() {
        assertThrows(InsufficientHistoryException.class,
            () -> Differencer.difference(new double[] {1, 2, 3, 4}, 1, 1, 4));
        assertThrows(InsufficientHistoryException.class,
            () -> Differencer.difference(new double[][] {{1}, {2}}, 2, 0, 0));
        assertThrows(InsufficientHistoryException.class,
            () -> Differencer.integrate(new double[] {1}, new double[] {1, 2}, 1, 1, 4));
    }

    @Test
    public void regressorRowsAreDifferencedPerColumn() {
        double[][] rows = {{1, 10}, {2, 20}, {4, 40}, {7, 70}};
        double[][] diffed = Differencer.difference(rows, 1, 0, 0);
        assertEquals(3, diffed.length);
        assertArrayEquals(new double[] {1, 10}, diffed[0], EPS);
        assertArrayEquals(new double[] {2, 20}, diffed[1], EPS);
        assertArrayEquals(new double[] {3, 30}, diffed[2], EPS);

        double[][] same = Differencer.difference(rows, 0, 0, 0);
        assertNotSame(rows[0], same[0]);
        assertArrayEquals(rows[3], same[3], EPS);
    }

    /** Differencing the full series and integrating its tail over the head gives the tail back. */
    private static void assertRoundTrip(double[] y, int cutoff, int d, int D, int s) {
        double[] train = Arrays.copyOfRange(y, 0, cutoff);
        double[] future = Arrays.copyOfRange(y, cutoff, y.length);
        double[] diffed = Differencer.difference(y, d, D, s);
        double[] tail = Arrays.copyOfRange(diffed, diffed.length - future.length, diffed.length);
        assertArrayEquals(future, Differencer.integrate(tail, train, d, D, s), EPS);
    }
}
