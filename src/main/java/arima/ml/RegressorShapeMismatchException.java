package arima.ml;

/** Exogenous rows do not match the series length, the forecast horizon or the fitted width. */
public class RegressorShapeMismatchException extends ArimaException {

    public RegressorShapeMismatchException(String message) {
        super(message);
    }
}
