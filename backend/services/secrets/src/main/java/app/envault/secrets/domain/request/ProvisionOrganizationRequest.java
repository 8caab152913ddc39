package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

/**
 * @param organizationId optional; a random id is assigned when absent
 */
public record ProvisionOrganizationRequest(
        UUID organizationId,
        String name,
        UUID actorId
) {

    public ProvisionOrganizationRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        Objects.requireNonNull(actorId, "actorId is required");
        name = name.trim();
    }
}
