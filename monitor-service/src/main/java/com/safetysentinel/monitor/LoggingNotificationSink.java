package com.safetysentinel.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.safetysentinel.core.alerting.NotificationSink;
import com.safetysentinel.core.model.Alert;
import com.safetysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NotificationSink} that renders alerts as JSON and writes them to the
 * {@code com.safetysentinel.notifications} logger.
 *
 * <p>
 * Stands in for real delivery channels. EMERGENCY alerts are logged at ERROR,
 * everything else at WARN.
 * </p>
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger LOG = LoggerFactory.getLogger("com.safetysentinel.notifications");

    private final ObjectMapper mapper;

    public LoggingNotificationSink() {
        this(defaultMapper());
    }

    LoggingNotificationSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void notify(Alert alert) throws JsonProcessingException {
        String json = render(alert);
        if (alert.getSeverity() == Severity.EMERGENCY) {
            LOG.error("ALERT {}", json);
        } else {
            LOG.warn("ALERT {}", json);
        }
    }

    /**
     * @param alert alert to render
     * @return the alert as a single-line JSON document
     * @throws JsonProcessingException if the alert cannot be serialized
     */
    String render(Alert alert) throws JsonProcessingException {
        return mapper.writeValueAsString(alert);
    }

    static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
