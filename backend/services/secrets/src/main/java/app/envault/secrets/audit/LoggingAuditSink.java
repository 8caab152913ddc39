package app.envault.secrets.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit events to a dedicated logger, one line per event with metadata as JSON.
 */
@Component
public class LoggingAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("app.envault.secrets.AUDIT");

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void log(AuditEvent event) {
        audit.info("audit eventId={} action={} organizationId={} actorId={} resourceType={} resourceId={} resourceName={} metadata={}",
                event.eventId(),
                event.action().code(),
                event.organizationId(),
                event.actorId(),
                event.resourceType(),
                event.resourceId(),
                event.resourceName(),
                renderMetadata(event));
    }

    String renderMetadata(AuditEvent event) {
        try {
            return objectMapper.writeValueAsString(event.metadata());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Audit metadata of event " + event.eventId() + " is not serializable", ex);
        }
    }
}
