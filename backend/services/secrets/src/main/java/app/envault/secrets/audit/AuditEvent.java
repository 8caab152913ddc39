package app.envault.secrets.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audit record. {@code metadata} carries identifiers and counters only, never secret values.
 */
public record AuditEvent(
        UUID eventId,
        UUID organizationId,
        UUID actorId,
        AuditAction action,
        String resourceType,
        UUID resourceId,
        String resourceName,
        Map<String, Object> metadata,
        Instant occurredAt
) {

    public static final String SECRET = "secret";
    public static final String ENVIRONMENT = "environment";
    public static final String ORGANIZATION = "organization";

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuditEvent of(UUID organizationId,
                                UUID actorId,
                                AuditAction action,
                                String resourceType,
                                UUID resourceId,
                                String resourceName,
                                Map<String, Object> metadata) {
        return new AuditEvent(UUID.randomUUID(), organizationId, actorId, action, resourceType,
                resourceId, resourceName, metadata, Instant.now());
    }
}
