package arima.ml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A training series with optional regressor rows, as loaded from a CSV file.
 */
public final class TimeSeriesData {

    private final double[] values;
    /** One row per period, or null when the file carries no regressor columns. */
    private final double[][] regressors;

    public TimeSeriesData(double[] values, double[][] regressors) {
        if (values == null || values.length == 0) throw new IllegalArgumentException("values required");
        this.values = values;
        this.regressors = (regressors != null && regressors.length == values.length) ? regressors : null;
    }

    public double[] getValues() { return values; }
    public double[][] getRegressors() { return regressors; }

    public boolean hasRegressors() {
        return regressors != null;
    }

    /**
     * Load a series (and optional regressors) from a CSV. Expected: one row per
     * period, first column = series value, remaining columns = regressors.
     * Blank lines, '#' comments and non-numeric lines such as headers are skipped.
     */
    public static TimeSeriesData fromCsv(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path);
        List<Double> valueList = new ArrayList<>();
        List<double[]> rowList = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]+");
            if (parts.length < 1) continue;
            double value;
            double[] row = new double[parts.length - 1];
            try {
                value = Double.parseDouble(parts[0].trim());
                for (int j = 1; j < parts.length; j++) row[j - 1] = Double.parseDouble(parts[j].trim());
            } catch (NumberFormatException e) {
                continue; // header or invalid line
            }
            valueList.add(value);
            if (row.length > 0) rowList.add(row);
        }
        if (valueList.isEmpty()) throw new IllegalArgumentException("No numeric rows in " + path);
        double[] values = valueList.stream().mapToDouble(Double::doubleValue).toArray();
        double[][] regressors = rowList.size() == values.length ? rowList.toArray(new double[0][]) : null;
        return new TimeSeriesData(values, regressors);
    }
}
