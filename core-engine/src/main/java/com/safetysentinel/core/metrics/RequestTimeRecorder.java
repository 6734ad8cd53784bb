package com.safetysentinel.core.metrics;

import com.safetysentinel.core.buffer.BoundedBuffer;
import com.safetysentinel.core.model.RequestSample;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Retains the most recent request samples and derives the request health
 * figures the background loop publishes as metrics.
 *
 * @since 1.0.0
 */
public class RequestTimeRecorder {

    private final BoundedBuffer<RequestSample> samples;
    private final Clock clock;

    public RequestTimeRecorder(int capacity, Clock clock) {
        this.samples = new BoundedBuffer<>(capacity);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param endpoint        request path or route name
     * @param durationSeconds request duration in seconds
     * @param statusCode      HTTP status code
     * @return the stored sample
     */
    public RequestSample record(String endpoint, double durationSeconds, int statusCode) {
        RequestSample sample = new RequestSample(endpoint, durationSeconds, statusCode, clock.instant());
        samples.push(sample);
        return sample;
    }

    public int totalRequests() {
        return samples.size();
    }

    /**
     * @return fraction of retained samples with status &gt;= 400, or 0 if
     *         there are none
     */
    public double errorRate() {
        List<RequestSample> snapshot = samples.snapshot();
        if (snapshot.isEmpty()) {
            return 0.0;
        }
        long errors = snapshot.stream().filter(RequestSample::isError).count();
        return (double) errors / snapshot.size();
    }

    /**
     * @return mean duration in seconds of the retained samples, or 0
     */
    public double averageResponseTime() {
        return samples.snapshot().stream()
                .mapToDouble(RequestSample::getDurationSeconds)
                .average()
                .orElse(0.0);
    }

    /**
     * @return error counts per endpoint over the retained samples, sorted by
     *         endpoint
     */
    public Map<String, Integer> errorCountsByEndpoint() {
        Map<String, Integer> counts = new TreeMap<>();
        for (RequestSample s : samples.snapshot()) {
            if (s.isError()) {
                counts.merge(s.getEndpoint(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
