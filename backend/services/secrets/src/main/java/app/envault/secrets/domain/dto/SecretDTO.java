package app.envault.secrets.domain.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * @param value      plaintext, present only when the caller asked for it
 * @param kekVersion version of the organization KEK wrapping the current version's DEK
 * @param createdBy  author of the current version
 */
public record SecretDTO(
        UUID id,
        UUID environmentId,
        String path,
        String key,
        String value,
        int version,
        UUID currentVersionId,
        int kekVersion,
        String description,
        List<String> tags,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt
) {

    @Override
    public String toString() {
        return "SecretDTO[id=" + id + ", path=" + path + ", key=" + key + ", version=" + version
                + ", value=" + (value == null ? "absent" : "<redacted>") + "]";
    }
}
