package arima.ml;

/** Series too short for the requested orders and differencing. */
public class InsufficientHistoryException extends ArimaException {

    public InsufficientHistoryException(String message) {
        super(message);
    }
}
