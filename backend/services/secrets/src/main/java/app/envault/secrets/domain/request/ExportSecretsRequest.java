package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

public record ExportSecretsRequest(
        UUID organizationId,
        UUID environmentId,
        UUID actorId,
        String pathPrefix
) {

    public ExportSecretsRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(environmentId, "environmentId is required");
        Objects.requireNonNull(actorId, "actorId is required");
    }
}
