package org.calista.r3.state;

/**
 * Result of {@link ConvergenceDetector#detect}.
 */
public final class ConvergenceReport {

    public final boolean converged;
    /** 1 - min(1, avgChange * 10); 0 when there are too few samples. */
    public final double confidence;
    public final double avgChange;
    public final double stdChange;
    /** Mean signed change over the window. */
    public final double trend;
    public final int samples;

    public ConvergenceReport(boolean converged, double confidence, double avgChange, double stdChange,
                             double trend, int samples) {
        this.converged = converged;
        this.confidence = confidence;
        this.avgChange = avgChange;
        this.stdChange = stdChange;
        this.trend = trend;
        this.samples = samples;
    }

    public static ConvergenceReport insufficient(int samples) {
        return new ConvergenceReport(false, 0.0, 0.0, 0.0, 0.0, samples);
    }

    @Override
    public String toString() {
        return "ConvergenceReport{converged=" + converged
                + ", confidence=" + confidence
                + ", avgChange=" + avgChange
                + ", stdChange=" + stdChange
                + ", samples=" + samples
                + '}';
    }
}
