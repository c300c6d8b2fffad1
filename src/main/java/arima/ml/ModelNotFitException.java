package arima.ml;

public class ModelNotFitException extends ArimaException {

    public ModelNotFitException() {
        super("Model must be fit before predict");
    }
}
