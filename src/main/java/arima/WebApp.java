package arima;

import arima.ml.EstimatorSettings;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON API over the forecasting library.
 * Run with: mvn exec:java -Dexec.mainClass="arima.WebApp"
 * <p>
 * POST /api/forecast, POST /api/predict, GET /api/sample, GET /api/health.
 * The port comes from the PORT environment variable (default 7000).
 */
public class WebApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebApp.class);
    private static final Gson GSON = new Gson();
    private static final Type REQUEST_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid PORT '{}'", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        EstimatorSettings settings = EstimatorSettings.load();
        ForecastService service = new ForecastService(settings);
        Javalin app = Javalin.create().start("0.0.0.0", port);

        app.post("/api/forecast", ctx -> handle(ctx, service::forecast));
        app.post("/api/predict", ctx -> handle(ctx, service::predict));

        app.get("/api/sample", ctx -> sendJson(ctx, 200, ForecastService.sampleSeries()));

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, 200, h);
        });

        LOG.info("Forecast API listening on http://localhost:{} with {}", port, settings);
    }

    private static void handle(Context ctx, Function<Map<String, Object>, Map<String, Object>> action) {
        try {
            String body = ctx.body();
            if (body == null || body.isBlank()) {
                throw new IllegalArgumentException("Missing request body");
            }
            Map<String, Object> req;
            try {
                req = GSON.fromJson(body, REQUEST_TYPE);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
            }
            if (req == null) throw new IllegalArgumentException("Invalid JSON");
            sendJson(ctx, 200, action.apply(req));
        } catch (RuntimeException e) {
            if (ForecastService.isClientError(e)) {
                LOG.debug("Rejected {} request: {}", ctx.path(), e.getMessage());
                sendJson(ctx, 400, ForecastService.error(e));
            } else {
                LOG.error("Failed to handle {}", ctx.path(), e);
                sendJson(ctx, 500, ForecastService.error(e));
            }
        }
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
