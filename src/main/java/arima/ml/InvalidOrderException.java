package arima.ml;

/** Negative order, or a seasonal term with period s &lt;= 1. */
public class InvalidOrderException extends ArimaException {

    public InvalidOrderException(String message) {
        super(message);
    }
}
