package com.iotstuff.anomaly.engine;

import java.util.List;

/**
 * Summary statistics over a window of readings.
 */
public final class WindowStatistics {

    private WindowStatistics() {}

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Mean of an empty window is undefined");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (N-1 denominator). Windows of one reading or fewer report 1.0.
     */
    public static double sampleStdDev(List<Double> values) {
        if (values.size() <= 1) {
            return 1.0;
        }
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (values.size() - 1));
    }

    /**
     * Median; the average of the two middle values for even-sized windows.
     */
    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Median of an empty window is undefined");
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Median of absolute deviations from {@code center}.
     */
    public static double medianAbsoluteDeviation(List<Double> values, double center) {
        return median(values.stream().map(v -> Math.abs(v - center)).toList());
    }
}
