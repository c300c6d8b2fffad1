package arima.ml;

/** Optimization ended with a non-finite objective or a non-positive residual variance. */
public class DegenerateFitException extends ArimaException {

    public DegenerateFitException(String message) {
        super(message);
    }

    public DegenerateFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
