package app.envault.secrets.domain.request;

import app.envault.secrets.support.SecretNames;

import java.util.Objects;
import java.util.UUID;

/**
 * Addresses one secret by its (environment, path, key) tuple inside an organization.
 */
public record SecretCoordinates(
        UUID organizationId,
        UUID environmentId,
        String path,
        String key
) {

    public SecretCoordinates {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(environmentId, "environmentId is required");
        path = SecretNames.normalizePath(path);
        key = SecretNames.requireKey(key);
    }

    public static SecretCoordinates atRoot(UUID organizationId, UUID environmentId, String key) {
        return new SecretCoordinates(organizationId, environmentId, SecretNames.ROOT_PATH, key);
    }
}
