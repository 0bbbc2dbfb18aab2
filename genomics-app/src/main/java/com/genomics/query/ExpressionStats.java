package com.genomics.query;

/**
 * Expression summary for one gene. {@code variance} is the sample variance,
 * 0 when only one value was seen.
 */
public record ExpressionStats(long count, double mean, double variance) {

    /**
     * Welford's running mean and variance.
     */
    static final class Accumulator {
        private long count;
        private double mean;
        private double m2;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
        }

        ExpressionStats result() {
            return new ExpressionStats(count, mean, count > 1 ? m2 / (count - 1) : 0.0);
        }
    }
}
