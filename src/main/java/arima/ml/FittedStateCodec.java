package arima.ml;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * JSON form of a {@link FittedState}, for saving a fit and forecasting from it later.
 * The JSON mirrors the state's fields; decoding re-checks every invariant.
 */
public final class FittedStateCodec {

    private static final Gson GSON = new Gson();

    private FittedStateCodec() {
    }

    public static String toJson(FittedState state) {
        return GSON.toJson(state);
    }

    public static JsonElement toJsonTree(FittedState state) {
        return GSON.toJsonTree(state);
    }

    /** @throws IllegalArgumentException when the JSON is malformed or describes an inconsistent state */
    public static FittedState fromJson(String json) {
        try {
            return checked(GSON.fromJson(json, FittedState.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed fitted state: " + e.getMessage(), e);
        }
    }

    public static FittedState fromJsonTree(JsonElement json) {
        try {
            return checked(GSON.fromJson(json, FittedState.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed fitted state: " + e.getMessage(), e);
        }
    }

    private static FittedState checked(FittedState state) {
        if (state == null) throw new IllegalArgumentException("Empty fitted state");
        try {
            state.checkConsistency();
        } catch (InvalidOrderException e) {
            throw new IllegalArgumentException("Fitted state has an invalid order: " + e.getMessage(), e);
        }
        return state;
    }
}
