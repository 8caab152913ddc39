package app.envault.secrets.domain.request;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record BulkUpsertRequest(
        UUID organizationId,
        UUID environmentId,
        UUID actorId,
        List<Entry> entries
) {

    public BulkUpsertRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(environmentId, "environmentId is required");
        Objects.requireNonNull(actorId, "actorId is required");
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("entries must not be empty");
        }
        entries = List.copyOf(entries);
    }

    public record Entry(
            String path,
            String key,
            String value,
            String description,
            List<String> tags
    ) {

        public Entry {
            Objects.requireNonNull(value, "value is required");
        }
    }
}
