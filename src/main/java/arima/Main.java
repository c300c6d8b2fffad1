package arima;

import arima.ml.ArimaModel;
import arima.ml.EstimatorSettings;
import arima.ml.FittedState;
import arima.ml.OrderSpec;
import arima.ml.TimeSeriesData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Command line demo: fit a model and print its forecasts.
 * <pre>
 * Main [csv] [p,d,q] [P,D,Q,s] [horizon]
 * </pre>
 * Without a CSV the built-in monthly sample is used with SARIMA(1,0,1)(1,0,1)12.
 * The last {@code horizon} rows of a CSV with regressor columns supply the future regressors.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            run(args);
        } catch (IOException | RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.error("Forecast failed: {}", msg, e);
            System.err.println("Error: " + msg);
            System.exit(1);
        }
    }

    static void run(String[] args) throws IOException {
        int[] order = args.length > 1 ? parseInts(args[1], 3) : new int[] {1, 0, 1};
        int[] seasonal = args.length > 2 ? parseInts(args[2], 4) : new int[] {1, 0, 1, 12};
        int steps = args.length > 3 ? Integer.parseInt(args[3].trim()) : ForecastService.DEFAULT_HORIZON;

        double[] y;
        double[][] x = null;
        double[][] xFuture = null;
        if (args.length > 0 && !args[0].trim().isEmpty()) {
            TimeSeriesData data = TimeSeriesData.fromCsv(Paths.get(args[0].trim()));
            y = data.getValues();
            if (data.hasRegressors()) {
                if (steps < 1 || steps >= y.length) {
                    throw new IllegalArgumentException("Horizon " + steps + " leaves no training rows in a CSV of "
                        + y.length + " rows; the last horizon rows hold the future regressors");
                }
                // the trailing rows carry the future regressors, their series values are ignored
                int n = y.length - steps;
                double[][] rows = data.getRegressors();
                x = Arrays.copyOfRange(rows, 0, n);
                xFuture = Arrays.copyOfRange(rows, n, rows.length);
                y = Arrays.copyOfRange(y, 0, n);
            }
        } else {
            y = ForecastService.sampleSeries();
        }

        OrderSpec modelOrder = OrderSpec.sarima(order[0], order[1], order[2], seasonal[0], seasonal[1], seasonal[2], seasonal[3]);
        ArimaModel model = new ArimaModel(modelOrder, EstimatorSettings.load());
        double[] forecast = model.forecast(y, steps, x, xFuture);
        FittedState state = model.getFittedState();

        System.out.println("=== " + modelOrder + " on " + y.length + " observations ===");
        System.out.println("Coefficients: " + state.getCoefficients());
        System.out.printf("Residual variance = %.4f, converged = %s%n", state.getResidualVariance(), state.isConverged());
        System.out.println("Forecast next " + steps + " periods: " + format(forecast));
    }

    private static int[] parseInts(String arg, int expected) {
        String[] parts = arg.split(",");
        if (parts.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " comma-separated integers, got '" + arg + "'");
        }
        int[] out = new int[expected];
        for (int i = 0; i < expected; i++) out[i] = Integer.parseInt(parts[i].trim());
        return out;
    }

    private static String format(double[] a) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < a.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.2f", a[i]));
        }
        sb.append("]");
        return sb.toString();
    }
}
