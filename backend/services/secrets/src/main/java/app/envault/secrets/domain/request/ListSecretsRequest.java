package app.envault.secrets.domain.request;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * @param pathPrefix optional, matches the path itself and everything below it
 * @param tags       optional, a secret matches when it carries any of them
 * @param search     optional, case-insensitive substring of the key
 * @param page       1-based, defaults to 1
 * @param limit      defaults to the configured page size
 */
public record ListSecretsRequest(
        UUID organizationId,
        UUID environmentId,
        UUID actorId,
        boolean includeValues,
        String pathPrefix,
        List<String> tags,
        String search,
        Integer page,
        Integer limit
) {

    public ListSecretsRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(environmentId, "environmentId is required");
        Objects.requireNonNull(actorId, "actorId is required");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ListSecretsRequest all(UUID organizationId, UUID environmentId, UUID actorId, boolean includeValues) {
        return new ListSecretsRequest(organizationId, environmentId, actorId, includeValues, null, List.of(), null, null, null);
    }
}
