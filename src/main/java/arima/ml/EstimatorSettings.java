package arima.ml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tuning of the non-linear refinement step.
 * <p>
 * Defaults can be overridden by an {@code arima.properties} file on the
 * classpath, and those in turn by {@code arima.*} system properties:
 * <pre>
 * arima.optimizer=NELDER_MEAD | BOBYQA
 * arima.maxEvaluations=2000
 * arima.relativeTolerance=1e-10
 * arima.absoluteTolerance=1e-14
 * </pre>
 */
public final class EstimatorSettings {

    public enum Optimizer {
        /** Nelder-Mead simplex, unbounded, stops on relative change of the objective. */
        NELDER_MEAD,
        /** Powell's BOBYQA inside a box around the initial guess. */
        BOBYQA
    }

    public static final String RESOURCE = "/arima.properties";
    private static final String PREFIX = "arima.";

    private final Optimizer optimizer;
    private final int maxEvaluations;
    private final double relativeTolerance;
    private final double absoluteTolerance;

    public EstimatorSettings(Optimizer optimizer, int maxEvaluations, double relativeTolerance, double absoluteTolerance) {
        if (optimizer == null) throw new IllegalArgumentException("optimizer required");
        if (maxEvaluations < 1) throw new IllegalArgumentException("maxEvaluations must be positive: " + maxEvaluations);
        if (!(relativeTolerance > 0) || !(absoluteTolerance > 0)) {
            throw new IllegalArgumentException("Tolerances must be positive");
        }
        this.optimizer = optimizer;
        this.maxEvaluations = maxEvaluations;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }

    public static EstimatorSettings defaults() {
        return new EstimatorSettings(Optimizer.NELDER_MEAD, 2000, 1e-10, 1e-14);
    }

    /** Defaults, then {@code arima.properties} from the classpath, then system properties. */
    public static EstimatorSettings load() {
        Properties props = new Properties();
        try (InputStream in = EstimatorSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) props.setProperty(name, System.getProperty(name));
        }
        return fromProperties(props);
    }

    public static EstimatorSettings fromProperties(Properties props) {
        EstimatorSettings def = defaults();
        String optimizer = props.getProperty(PREFIX + "optimizer");
        String maxEval = props.getProperty(PREFIX + "maxEvaluations");
        String rel = props.getProperty(PREFIX + "relativeTolerance");
        String abs = props.getProperty(PREFIX + "absoluteTolerance");
        try {
            return new EstimatorSettings(
                optimizer == null ? def.optimizer : Optimizer.valueOf(optimizer.trim().toUpperCase(Locale.ROOT)),
                maxEval == null ? def.maxEvaluations : Integer.parseInt(maxEval.trim()),
                rel == null ? def.relativeTolerance : Double.parseDouble(rel.trim()),
                abs == null ? def.absoluteTolerance : Double.parseDouble(abs.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid estimator setting: " + e.getMessage(), e);
        }
    }

    public EstimatorSettings withOptimizer(Optimizer optimizer) {
        return new EstimatorSettings(optimizer, maxEvaluations, relativeTolerance, absoluteTolerance);
    }

    public EstimatorSettings withMaxEvaluations(int maxEvaluations) {
        return new EstimatorSettings(optimizer, maxEvaluations, relativeTolerance, absoluteTolerance);
    }

    public Optimizer getOptimizer() { return optimizer; }
    public int getMaxEvaluations() { return maxEvaluations; }
    public double getRelativeTolerance() { return relativeTolerance; }
    public double getAbsoluteTolerance() { return absoluteTolerance; }

    @Override
    public String toString() {
        return "EstimatorSettings{optimizer=" + optimizer + ", maxEvaluations=" + maxEvaluations
            + ", relativeTolerance=" + relativeTolerance + ", absoluteTolerance=" + absoluteTolerance + '}';
    }
}
