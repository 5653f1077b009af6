package com.phillippitts.wfmparity.service.calc;

/**
 * Erlang-B/Erlang-C queueing formulas.
 *
 * <p>Erlang B is evaluated with the stable recursion {@code B(k) = A·B(k-1) / (k + A·B(k-1))},
 * which avoids factorials and stays accurate for several thousand servers.
 */
public final class ErlangMath {

    private ErlangMath() {}

    /**
     * Offered load in Erlangs.
     *
     * @throws ArithmeticException if the interval is not positive
     */
    public static double trafficIntensity(double offeredCalls, double averageHandleTimeSec, double intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new ArithmeticException("interval length must be positive");
        }
        return offeredCalls * averageHandleTimeSec / intervalSeconds;
    }

    public static double erlangB(int agents, double load) {
        if (agents <= 0) {
            return 1.0;
        }
        double b = 1.0;
        for (int k = 1; k <= agents; k++) {
            b = load * b / (k + load * b);
        }
        return b;
    }

    /**
     * Probability that an arriving call has to wait. 1.0 when the queue is unstable ({@code agents <= load}).
     */
    public static double erlangC(int agents, double load) {
        if (agents <= load) {
            return 1.0;
        }
        double b = erlangB(agents, load);
        return agents * b / (agents - load * (1.0 - b));
    }

    /**
     * Fraction of calls answered within {@code answerSeconds}. 0 when the queue is unstable.
     */
    public static double serviceLevel(int agents, double load, double averageHandleTimeSec, double answerSeconds) {
        if (agents <= load) {
            return 0.0;
        }
        double c = erlangC(agents, load);
        return 1.0 - c * Math.exp(-(agents - load) * answerSeconds / averageHandleTimeSec);
    }

    /**
     * Average speed of answer over all calls, in seconds. Infinite when unstable.
     */
    public static double averageSpeedOfAnswer(int agents, double load, double averageHandleTimeSec) {
        if (agents <= load) {
            return Double.POSITIVE_INFINITY;
        }
        return erlangC(agents, load) * averageHandleTimeSec / (agents - load);
    }

    /**
     * Inverse standard normal CDF (rational approximation, relative error below 1.15e-9).
     *
     * @throws IllegalArgumentException unless {@code 0 < p < 1}
     */
    public static double probit(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new IllegalArgumentException("p must be in (0,1), got: " + p);
        }
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
                1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
                6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
                -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
                3.754408661907416e+00};
        final double pLow = 0.02425;

        if (p < pLow) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        if (p > 1 - pLow) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
                / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
    }
}
