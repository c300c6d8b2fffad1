package arima.ml;

/**
 * Base of every failure raised while specifying, fitting or forecasting a model.
 * All subclasses are unchecked and surface synchronously from the failing call.
 */
public class ArimaException extends RuntimeException {

    public ArimaException(String message) {
        super(message);
    }

    public ArimaException(String message, Throwable cause) {
        super(message, cause);
    }
}
