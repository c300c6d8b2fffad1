package arima.ml;

import java.util.Objects;

/**
 * Order specification of a SARIMA(p,d,q)(P,D,Q)s model.
 * <p>
 * - p,d,q: non-seasonal AR order, differencing, MA order
 * - P,D,Q: seasonal AR, seasonal differencing, seasonal MA
 * - s: season length, only meaningful when one of P,D,Q is nonzero
 * <p>
 * AR, MA, ARMA and ARIMA are the same record with some orders fixed at zero.
 */
public final class OrderSpec {

    private final int p, d, q, P, D, Q, s;

    private OrderSpec(int p, int d, int q, int P, int D, int Q, int s) {
        this.p = p;
        this.d = d;
        this.q = q;
        this.P = P;
        this.D = D;
        this.Q = Q;
        this.s = s;
        validate();
    }

    public static OrderSpec sarima(int p, int d, int q, int P, int D, int Q, int s) {
        return new OrderSpec(p, d, q, P, D, Q, s);
    }

    public static OrderSpec arima(int p, int d, int q) {
        return new OrderSpec(p, d, q, 0, 0, 0, 0);
    }

    public static OrderSpec arma(int p, int q) {
        return arima(p, 0, q);
    }

    public static OrderSpec autoregressive(int p) {
        return arima(p, 0, 0);
    }

    public static OrderSpec movingAverage(int q) {
        return arima(0, 0, q);
    }

    /** Re-checks the invariants; used after the fields were populated reflectively. */
    void validate() {
        if (p < 0 || d < 0 || q < 0 || P < 0 || D < 0 || Q < 0 || s < 0) {
            throw new InvalidOrderException("Orders must be non-negative: " + this);
        }
        if (isSeasonal() && s <= 1) {
            throw new InvalidOrderException("Seasonal period s must exceed 1 when P, D or Q is nonzero: " + this);
        }
    }

    public boolean isSeasonal() {
        return P > 0 || D > 0 || Q > 0;
    }

    /** Observations consumed by differencing: d + s*D. */
    public int integrationOrder() {
        return d + s * D;
    }

    /** History of the differenced series the AR part looks back over. */
    public int arLag() {
        return Math.max(p, P * s);
    }

    /** History of the residual series the MA part looks back over. */
    public int maLag() {
        return Math.max(q, Q * s);
    }

    /** Leading differenced positions without enough history to form a residual. */
    public int burnIn() {
        return Math.max(arLag(), maLag());
    }

    /** Length of the coefficient vector for {@code exogWidth} regressors, intercept included. */
    public int parameterCount(int exogWidth) {
        return p + P + q + Q + exogWidth + 1;
    }

    /** Shortest training series that still leaves one estimation residual. */
    public int minimumObservations() {
        return integrationOrder() + burnIn() + 1;
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public int getSeasonalP() { return P; }
    public int getSeasonalD() { return D; }
    public int getSeasonalQ() { return Q; }
    public int getSeasonLength() { return s; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderSpec)) return false;
        OrderSpec that = (OrderSpec) o;
        return p == that.p && d == that.d && q == that.q
            && P == that.P && D == that.D && Q == that.Q && s == that.s;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, d, q, P, D, Q, s);
    }

    @Override
    public String toString() {
        if (!isSeasonal()) {
            return "ARIMA(" + p + "," + d + "," + q + ")";
        }
        return "SARIMA(" + p + "," + d + "," + q + ")(" + P + "," + D + "," + Q + ")" + s;
    }
}
