package app.envault.secrets.domain.dto;

import java.util.UUID;

/**
 * @param content dotenv text; contains plaintext values and must not be logged
 */
public record SecretExportDTO(
        UUID environmentId,
        String pathPrefix,
        int count,
        String content
) {

    @Override
    public String toString() {
        return "SecretExportDTO[environmentId=" + environmentId + ", pathPrefix=" + pathPrefix + ", count=" + count + "]";
    }
}
