package app.envault.secrets.audit;

/**
 * Destination for audit events. Storage lives outside this service; implementations may throw,
 * {@link AuditEventDispatcher} retries and then gives up without affecting the audited operation.
 * Delivery is at least once, so implementations should de-duplicate on {@link AuditEvent#eventId()}.
 * An event that finds the audit queue full never reaches a sink; {@link DroppedAuditEventHandler} logs it instead.
 */
public interface AuditSink {

    void log(AuditEvent event);
}
