package arima;

import arima.ml.ArimaException;
import arima.ml.ArimaModel;
import arima.ml.Coefficients;
import arima.ml.EstimatorSettings;
import arima.ml.FittedState;
import arima.ml.FittedStateCodec;
import arima.ml.OrderSpec;
import com.google.gson.Gson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request handling behind the HTTP endpoints, on plain maps as parsed by Gson.
 * <p>
 * Forecast request:
 * <pre>
 * {"y": [...], "x": [[...]], "xFuture": [[...]],
 *  "order": {"p": 1, "d": 0, "q": 1}, "seasonalOrder": {"P": 1, "D": 0, "Q": 1, "s": 12},
 *  "horizon": 6}
 * </pre>
 * Predict request: {@code {"state": {...}, "horizon": 6, "xFuture": [[...]]}}.
 */
public class ForecastService {

    static final int DEFAULT_HORIZON = 6;
    static final int MAX_HORIZON = 60;

    private static final Gson GSON = new Gson();

    private final EstimatorSettings settings;

    public ForecastService(EstimatorSettings settings) {
        this.settings = settings;
    }

    /** Fit the requested model on {@code y} (and {@code x}) and forecast. */
    public Map<String, Object> forecast(Map<String, Object> req) {
        double[] y = toArray(req.get("y"), "y");
        double[][] x = toMatrix(req.get("x"), "x");
        double[][] xFuture = toMatrix(req.get("xFuture"), "xFuture");
        int horizon = horizon(req);

        int p = 1, d = 0, q = 0, P = 0, D = 0, Q = 0, s = 0;
        Map<String, Object> order = toMap(req.get("order"), "order");
        if (order != null) {
            p = getInt(order, "p", p);
            d = getInt(order, "d", d);
            q = getInt(order, "q", q);
        }
        Map<String, Object> seasonal = toMap(req.get("seasonalOrder"), "seasonalOrder");
        if (seasonal != null) {
            P = getInt(seasonal, "P", P);
            D = getInt(seasonal, "D", D);
            Q = getInt(seasonal, "Q", Q);
            s = getInt(seasonal, "s", s);
        }

        ArimaModel model = new ArimaModel(OrderSpec.sarima(p, d, q, P, D, Q, s), settings);
        double[] forecast = model.forecast(y, horizon, x, xFuture);
        FittedState state = model.getFittedState();

        Map<String, Object> out = new HashMap<>();
        out.put("forecast", toList(forecast));
        out.put("model", state.getOrder().toString());
        out.put("coefficients", coefficients(state.getCoefficients()));
        out.put("residualVariance", state.getResidualVariance());
        out.put("converged", state.isConverged());
        out.put("evaluations", state.getEvaluations());
        out.put("state", FittedStateCodec.toJsonTree(state));
        return out;
    }

    /** Forecast from a state returned by an earlier {@link #forecast} call, without refitting. */
    public Map<String, Object> predict(Map<String, Object> req) {
        Object raw = req.get("state");
        if (raw == null) throw new IllegalArgumentException("Missing 'state'");
        FittedState state = FittedStateCodec.fromJsonTree(GSON.toJsonTree(raw));
        double[][] xFuture = toMatrix(req.get("xFuture"), "xFuture");

        ArimaModel model = ArimaModel.restored(state, settings);
        Map<String, Object> out = new HashMap<>();
        out.put("forecast", toList(model.predict(horizon(req), xFuture)));
        out.put("model", state.getOrder().toString());
        return out;
    }

    /** Error body: message plus the failure kind, e.g. "InsufficientHistoryException". */
    public static Map<String, Object> error(Throwable e) {
        Map<String, Object> err = new HashMap<>();
        String msg = e.getMessage();
        err.put("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        err.put("kind", e.getClass().getSimpleName());
        return err;
    }

    /** Whether {@code e} is the caller's fault rather than ours. */
    public static boolean isClientError(Throwable e) {
        return e instanceof ArimaException || e instanceof IllegalArgumentException;
    }

    /** Sample monthly series with yearly seasonality. */
    public static double[] sampleSeries() {
        return new double[] {
            45, 52, 61, 78, 88, 95, 102, 98, 85, 72, 58, 48,
            50, 55, 65, 82, 92, 100, 108, 104, 88, 75, 62, 51,
            48, 54, 68, 85, 94, 103, 112, 106, 90, 78, 64, 52,
            52, 58, 70, 86, 96, 105, 115, 108, 92, 80, 66, 55
        };
    }

    private static Map<String, Object> coefficients(Coefficients c) {
        Map<String, Object> m = new HashMap<>();
        m.put("ar", toList(c.getAr()));
        m.put("seasonalAr", toList(c.getSeasonalAr()));
        m.put("ma", toList(c.getMa()));
        m.put("seasonalMa", toList(c.getSeasonalMa()));
        m.put("exogenous", toList(c.getExogenous()));
        m.put("intercept", c.getIntercept());
        return m;
    }

    private static int horizon(Map<String, Object> req) {
        Object h = req.get("horizon");
        if (h == null) return DEFAULT_HORIZON;
        if (!(h instanceof Number)) throw new IllegalArgumentException("'horizon' must be a number");
        return Math.max(1, Math.min(((Number) h).intValue(), MAX_HORIZON));
    }

    private static int getInt(Map<String, Object> m, String key, int def) {
        Object v = m.get(key);
        if (v == null) return def;
        if (!(v instanceof Number)) throw new IllegalArgumentException("'" + key + "' must be a number");
        return ((Number) v).intValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(Object o, String name) {
        if (o == null) return null;
        if (!(o instanceof Map<?, ?>)) throw new IllegalArgumentException("'" + name + "' must be an object");
        return (Map<String, Object>) o;
    }

    private static double[] toArray(Object o, String name) {
        if (!(o instanceof List<?>)) throw new IllegalArgumentException("Missing or invalid '" + name + "' array");
        List<?> list = (List<?>) o;
        if (list.isEmpty()) throw new IllegalArgumentException("Empty '" + name + "' array");
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            Object v = list.get(i);
            if (!(v instanceof Number)) throw new IllegalArgumentException("All '" + name + "' values must be numbers");
            out[i] = ((Number) v).doubleValue();
        }
        return out;
    }

    private static double[][] toMatrix(Object o, String name) {
        if (o == null) return null;
        if (!(o instanceof List<?>)) throw new IllegalArgumentException("'" + name + "' must be an array of rows");
        List<?> rows = (List<?>) o;
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < out.length; i++) {
            Object row = rows.get(i);
            out[i] = row instanceof List<?> && ((List<?>) row).isEmpty() ? new double[0] : toArray(row, name);
        }
        return out;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }
}
