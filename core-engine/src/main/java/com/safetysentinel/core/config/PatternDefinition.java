package com.safetysentinel.core.config;

/**
 * YAML-bindable form of a {@link PatternThreshold}.
 *
 * <pre>
 * patterns:
 *   - eventType: inappropriate_content
 *     threshold: 5
 *     name: excessive_inappropriate_content
 * </pre>
 */
public class PatternDefinition {

    private String eventType;
    private int threshold;
    private String name;

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public int getThreshold() {
        return threshold;
    }

    public void setThreshold(int threshold) {
        this.threshold = threshold;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the validated threshold
     * @throws IllegalArgumentException if the event type is missing or the
     *                                  threshold is below 1
     */
    public PatternThreshold toThreshold() {
        if (eventType == null) {
            throw new IllegalArgumentException("Pattern 'eventType' is required");
        }
        return new PatternThreshold(eventType, threshold, name);
    }

    @Override
    public String toString() {
        return "PatternDefinition{eventType='" + eventType + "', threshold=" + threshold + ", name='" + name + "'}";
    }
}
