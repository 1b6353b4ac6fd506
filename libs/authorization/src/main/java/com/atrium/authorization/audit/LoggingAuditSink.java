package com.atrium.authorization.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes each audit event as one JSON line to the {@value #LOGGER_NAME} logger.
 * <p>
 * {@code tenantId} and {@code userId} are placed in the MDC for the duration of the log call so
 * log pipelines can index them without parsing the message.
 */
public final class LoggingAuditSink implements AuditSink {

    /** Logger that receives audit lines; route it to a dedicated appender. */
    public static final String LOGGER_NAME = "atrium.authorization.audit";

    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Logger auditLog;

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    LoggingAuditSink(Logger auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public void emit(AuthorizationAuditEvent event) {
        String json = toJson(event);
        MDC.put(MDC_TENANT_ID, event.tenantId());
        MDC.put(MDC_USER_ID, event.userId());
        try {
            auditLog.info(json);
        } finally {
            MDC.remove(MDC_TENANT_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    /**
     * Serializes an event to JSON with an ISO-8601 timestamp.
     *
     * @throws AuditSerializationException if serialization fails
     */
    public static String toJson(AuthorizationAuditEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit event " + event.eventId(), e);
        }
    }

    /**
     * Parses an event previously written by {@link #toJson(AuthorizationAuditEvent)}.
     *
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuthorizationAuditEvent fromJson(String json) {
        try {
            return MAPPER.readValue(json, AuthorizationAuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit event", e);
        }
    }

    /**
     * Thrown when an audit event cannot be converted to or from JSON.
     */
    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
