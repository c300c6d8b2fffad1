package arima.ml;

/**
 * Static regressors for the usable indices of a differenced series.
 * Row {@code i} describes time index {@code startIndex + i}; columns are
 * AR lags, seasonal AR lags, then exogenous values. The constant column is
 * left to the regression.
 */
public final class DesignMatrix {

    private final double[][] rows;
    private final double[] targets;
    private final int startIndex;

    DesignMatrix(double[][] rows, double[] targets, int startIndex) {
        this.rows = rows;
        this.targets = targets;
        this.startIndex = startIndex;
    }

    public double[][] getRows() { return rows; }
    public double[] getTargets() { return targets; }
    public int getStartIndex() { return startIndex; }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return rows.length == 0 ? 0 : rows[0].length;
    }
}
