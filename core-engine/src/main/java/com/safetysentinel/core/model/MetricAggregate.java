package com.safetysentinel.core.model;

/**
 * Count, min, max, mean and latest value of a metric over a window.
 *
 * @since 1.0.0
 */
public final class MetricAggregate {

    private static final MetricAggregate EMPTY = new MetricAggregate(0, 0, 0, 0, 0);

    private final int count;
    private final double min;
    private final double max;
    private final double avg;
    private final double latest;

    public MetricAggregate(int count, double min, double max, double avg, double latest) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.avg = avg;
        this.latest = latest;
    }

    /**
     * @return the zeroed aggregate reported for unknown names and empty windows
     */
    public static MetricAggregate empty() {
        return EMPTY;
    }

    public int getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getAvg() {
        return avg;
    }

    public double getLatest() {
        return latest;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public String toString() {
        return "MetricAggregate{" +
                "count=" + count +
                ", min=" + min +
                ", max=" + max +
                ", avg=" + avg +
                ", latest=" + latest +
                '}';
    }
}
