package com.adautopilot.common.prediction;

/**
 * Beta(α, β) posterior helpers: mean, CDF and inverse CDF.
 *
 * <h3>Model</h3>
 * <pre>
 *   Prior:     Beta(priorAlpha, priorBeta)
 *   Posterior: Beta(priorAlpha + conversions, priorBeta + clicks - conversions)
 * </pre>
 *
 * <p>The CDF is the regularized incomplete beta function I_x(a, b), computed with the
 * modified Lentz continued fraction and a Lanczos log-gamma.
 * The inverse CDF bisects I_x(a, b) on [0, 1], which is monotone in x, to within
 * {@link #INVERSE_TOLERANCE}.
 *
 * <p>Pure static utility, no state.
 */
public final class BetaDistribution {

    static final double INVERSE_TOLERANCE = 1e-10;
    private static final int INVERSE_MAX_ITER = 200;

    // large posteriors (tens of thousands of clicks) need more terms than small ones
    private static final int    CF_MAX_TERMS = 500;
    private static final double CF_EPSILON   = 1e-12;
    private static final double CF_FLOOR     = 1e-300;

    private static final double   LANCZOS_G      = 7.0;
    private static final double   HALF_LN_TWO_PI = 0.5 * Math.log(2.0 * Math.PI);
    private static final double[] LANCZOS = {
          0.99999999999980993,
        676.5203681218851,
      -1259.1392167224028,
        771.32342877765313,
       -176.61502916214059,
         12.507343278686905,
         -0.13857109526572012,
          9.9843695780195716e-6,
          1.5056327351493116e-7
    };

    private BetaDistribution() {}

    public static double mean(double alpha, double beta) {
        return alpha / (alpha + beta);
    }

    /** P(X ≤ x) for X ~ Beta(a, b). */
    public static double cdf(double x, double a, double b) {
        return regularizedIncompleteBeta(x, a, b);
    }

    /**
     * Smallest x with {@code cdf(x, a, b) >= p}.
     *
     * @param p probability in [0, 1]
     */
    public static double inverseCdf(double p, double a, double b) {
        if (a <= 0.0 || b <= 0.0) {
            throw new IllegalArgumentException("Beta parameters must be positive: a=" + a + " b=" + b);
        }
        if (p <= 0.0) return 0.0;
        if (p >= 1.0) return 1.0;

        double lo = 0.0;
        double hi = 1.0;
        for (int i = 0; i < INVERSE_MAX_ITER && hi - lo > INVERSE_TOLERANCE; i++) {
            double mid = (lo + hi) / 2.0;
            if (regularizedIncompleteBeta(mid, a, b) < p) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return (lo + hi) / 2.0;
    }

    // ── Regularized incomplete beta I_x(a, b) ──────────────────────────────

    static double regularizedIncompleteBeta(double x, double a, double b) {
        if (x <= 0.0) return 0.0;
        if (x >= 1.0) return 1.0;

        // above the mean the symmetric form converges faster
        if (x > (a + 1.0) / (a + b + 2.0)) {
            return 1.0 - regularizedIncompleteBeta(1.0 - x, b, a);
        }

        double logFactor = lnGamma(a + b) - lnGamma(a) - lnGamma(b)
            + a * Math.log(x) + b * Math.log(1.0 - x) - Math.log(a);

        return Math.exp(logFactor) * continuedFraction(x, a, b);
    }

    /**
     * Modified Lentz evaluation of the continued fraction of I_x(a, b). Each
     * pass folds in one even and one odd term.
     */
    private static double continuedFraction(double x, double a, double b) {
        double c = 1.0;
        double d = 1.0 / awayFromZero(1.0 - (a + b) * x / (a + 1.0));
        double fraction = d;

        for (int m = 1; m <= CF_MAX_TERMS; m++) {
            double even = m * (b - m) * x / ((a + 2 * m - 1) * (a + 2 * m));
            d = 1.0 / awayFromZero(1.0 + even * d);
            c = awayFromZero(1.0 + even / c);
            fraction *= d * c;

            double odd = -(a + m) * (a + b + m) * x / ((a + 2 * m) * (a + 2 * m + 1));
            d = 1.0 / awayFromZero(1.0 + odd * d);
            c = awayFromZero(1.0 + odd / c);
            double step = d * c;
            fraction *= step;

            if (Math.abs(step - 1.0) < CF_EPSILON) {
                break;
            }
        }
        return fraction;
    }

    private static double awayFromZero(double v) {
        return Math.abs(v) < CF_FLOOR ? CF_FLOOR : v;
    }

    /**
     * ln Γ(x) for x &gt; 0, Lanczos with g = 7 and nine coefficients. Arguments
     * below 0.5 go through the reflection formula.
     */
    static double lnGamma(double x) {
        if (x < 0.5) {
            return Math.log(Math.PI / Math.sin(Math.PI * x)) - lnGamma(1.0 - x);
        }
        double z = x - 1.0;
        double series = LANCZOS[0];
        for (int i = 1; i < LANCZOS.length; i++) {
            series += LANCZOS[i] / (z + i);
        }
        double t = z + LANCZOS_G + 0.5;
        return HALF_LN_TWO_PI + (z + 0.5) * Math.log(t) - t + Math.log(series);
    }
}
