package com.safetysentinel.core.model;

/**
 * Point-in-time summary served to the dashboard collaborator.
 *
 * @since 1.0.0
 */
public final class MetricsSummary {

    private final int totalMetrics;
    private final int activeAlerts;
    private final int totalRequests;
    private final double errorRate;
    private final double avgResponseTime;
    private final int activeConnections;
    private final int childSafetyEventCount;

    public MetricsSummary(int totalMetrics, int activeAlerts, int totalRequests, double errorRate,
            double avgResponseTime, int activeConnections, int childSafetyEventCount) {
        this.totalMetrics = totalMetrics;
        this.activeAlerts = activeAlerts;
        this.totalRequests = totalRequests;
        this.errorRate = errorRate;
        this.avgResponseTime = avgResponseTime;
        this.activeConnections = activeConnections;
        this.childSafetyEventCount = childSafetyEventCount;
    }

    /**
     * @return number of distinct metric names currently retained
     */
    public int getTotalMetrics() {
        return totalMetrics;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    /**
     * @return number of request samples currently retained
     */
    public int getTotalRequests() {
        return totalRequests;
    }

    public double getErrorRate() {
        return errorRate;
    }

    /**
     * @return mean request duration in seconds
     */
    public double getAvgResponseTime() {
        return avgResponseTime;
    }

    public int getActiveConnections() {
        return activeConnections;
    }

    public int getChildSafetyEventCount() {
        return childSafetyEventCount;
    }

    @Override
    public String toString() {
        return "MetricsSummary{" +
                "totalMetrics=" + totalMetrics +
                ", activeAlerts=" + activeAlerts +
                ", totalRequests=" + totalRequests +
                ", errorRate=" + errorRate +
                ", avgResponseTime=" + avgResponseTime +
                ", activeConnections=" + activeConnections +
                ", childSafetyEventCount=" + childSafetyEventCount +
                '}';
    }
}
