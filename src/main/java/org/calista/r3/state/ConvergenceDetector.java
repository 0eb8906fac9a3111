package org.calista.r3.state;

import java.util.List;

/**
 * Detects convergence of a scalar history (Λ_total) from the successive differences of its most
 * recent samples.
 */
public final class ConvergenceDetector {

    private final int window;
    private final int minSamples;
    private final double avgChangeThreshold;
    private final double stdChangeThreshold;

    /** Fewer Λ samples than this always report zero confidence. */
    public static final int MIN_SAMPLES = 3;

    public ConvergenceDetector() {
        this(5, MIN_SAMPLES, 0.01, 0.02);
    }

    public ConvergenceDetector(int window, int minSamples, double avgChangeThreshold, double stdChangeThreshold) {
        if (window < 2) throw new IllegalArgumentException("window must be >= 2: " + window);
        if (minSamples < MIN_SAMPLES) throw new IllegalArgumentException("minSamples must be >= " + MIN_SAMPLES + ": " + minSamples);
        if (!(avgChangeThreshold > 0.0) || !(stdChangeThreshold > 0.0)) {
            throw new IllegalArgumentException("thresholds must be > 0");
        }
        this.window = window;
        this.minSamples = minSamples;
        this.avgChangeThreshold = avgChangeThreshold;
        this.stdChangeThreshold = stdChangeThreshold;
    }

    public ConvergenceReport detect(List<Double> history) {
        int n = (history == null ? 0 : history.size());
        if (n < minSamples) return ConvergenceReport.insufficient(n);

        List<Double> recent = history.subList(Math.max(0, n - window), n);
        int m = recent.size() - 1;
        double[] diffs = new double[m];
        for (int i = 0; i < m; i++) diffs[i] = recent.get(i + 1) - recent.get(i);

        double absSum = 0.0;
        double sum = 0.0;
        for (double d : diffs) {
            absSum += Math.abs(d);
            sum += d;
        }
        double avgChange = absSum / m;
        double mean = sum / m;

        double std = 0.0;
        if (m > 1) {
            double sq = 0.0;
            for (double d : diffs) sq += (d - mean) * (d - mean);
            std = Math.sqrt(sq / m);
        }

        if (!Double.isFinite(avgChange) || !Double.isFinite(std)) {
            return new ConvergenceReport(false, 0.0, avgChange, std, mean, n);
        }

        boolean converged = avgChange < avgChangeThreshold && std < stdChangeThreshold;
        double confidence = 1.0 - Math.min(1.0, avgChange * 10.0);
        return new ConvergenceReport(converged, confidence, avgChange, std, mean, n);
    }
}
