package com.bookedbarber.ratelimit.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit records as single-line JSON to the {@code AUDIT} logger, which logback routes
 * to its own appender.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordViolation(ViolationEvent event) {
        AUDIT.warn(toJson("rate_limit_violation", event));
    }

    @Override
    public void recordUsage(UsageRecord usage) {
        if (AUDIT.isDebugEnabled()) {
            AUDIT.debug(toJson("api_usage", usage));
        }
    }

    @Override
    public void raiseAlert(SecurityAlert alert) {
        AUDIT.error(toJson("security_alert", alert));
    }

    private String toJson(String eventType, Object payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event_type", eventType);
        envelope.put("payload", payload);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit event " + eventType, e);
        }
    }
}
