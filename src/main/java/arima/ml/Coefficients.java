package arima.ml;

import java.util.Arrays;

/**
 * Fitted coefficients, laid out as the flat vector
 * [φ₁..φₚ, Φ₁..Φ_P, θ₁..θq, Θ₁..Θ_Q, β₁..βₖ, c].
 */
public final class Coefficients {

    private final double[] ar;         // φ₁..φₚ
    private final double[] seasonalAr; // Φ₁..Φ_P
    private final double[] ma;         // θ₁..θq
    private final double[] seasonalMa; // Θ₁..Θ_Q
    private final double[] exogenous;  // β₁..βₖ
    private final double intercept;    // c

    public Coefficients(double[] ar, double[] seasonalAr, double[] ma, double[] seasonalMa,
                        double[] exogenous, double intercept) {
        this.ar = ar.clone();
        this.seasonalAr = seasonalAr.clone();
        this.ma = ma.clone();
        this.seasonalMa = seasonalMa.clone();
        this.exogenous = exogenous.clone();
        this.intercept = intercept;
    }

    /** Split a flat vector laid out as described on the class. */
    public static Coefficients fromArray(OrderSpec order, int exogWidth, double[] params) {
        if (params.length != order.parameterCount(exogWidth)) {
            throw new IllegalArgumentException("Expected " + order.parameterCount(exogWidth)
                + " parameters for " + order + " with " + exogWidth + " regressors, got " + params.length);
        }
        int idx = 0;
        double[] ar = Arrays.copyOfRange(params, idx, idx += order.getP());
        double[] seasonalAr = Arrays.copyOfRange(params, idx, idx += order.getSeasonalP());
        double[] ma = Arrays.copyOfRange(params, idx, idx += order.getQ());
        double[] seasonalMa = Arrays.copyOfRange(params, idx, idx += order.getSeasonalQ());
        double[] exogenous = Arrays.copyOfRange(params, idx, idx += exogWidth);
        return new Coefficients(ar, seasonalAr, ma, seasonalMa, exogenous, params[idx]);
    }

    public double[] toArray() {
        double[] out = new double[ar.length + seasonalAr.length + ma.length + seasonalMa.length + exogenous.length + 1];
        int idx = 0;
        for (double[] block : new double[][] {ar, seasonalAr, ma, seasonalMa, exogenous}) {
            System.arraycopy(block, 0, out, idx, block.length);
            idx += block.length;
        }
        out[idx] = intercept;
        return out;
    }

    /** True when the shape matches {@code order} with {@code exogWidth} regressors. */
    boolean matches(OrderSpec order, int exogWidth) {
        return ar != null && seasonalAr != null && ma != null && seasonalMa != null && exogenous != null
            && ar.length == order.getP() && seasonalAr.length == order.getSeasonalP()
            && ma.length == order.getQ() && seasonalMa.length == order.getSeasonalQ()
            && exogenous.length == exogWidth;
    }

    public double[] getAr() { return ar.clone(); }
    public double[] getSeasonalAr() { return seasonalAr.clone(); }
    public double[] getMa() { return ma.clone(); }
    public double[] getSeasonalMa() { return seasonalMa.clone(); }
    public double[] getExogenous() { return exogenous.clone(); }
    public double getIntercept() { return intercept; }

    // package-private views for the hot loops, callers must not write through them
    double[] ar() { return ar; }
    double[] seasonalAr() { return seasonalAr; }
    double[] ma() { return ma; }
    double[] seasonalMa() { return seasonalMa; }
    double[] exogenous() { return exogenous; }

    @Override
    public String toString() {
        return "Coefficients{ar=" + Arrays.toString(ar)
            + ", seasonalAr=" + Arrays.toString(seasonalAr)
            + ", ma=" + Arrays.toString(ma)
            + ", seasonalMa=" + Arrays.toString(seasonalMa)
            + ", exogenous=" + Arrays.toString(exogenous)
            + ", intercept=" + intercept + '}';
    }
}
