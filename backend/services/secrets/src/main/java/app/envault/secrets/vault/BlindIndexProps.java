package app.envault.secrets.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * scrypt cost parameters for blind indexes. Changing any of them changes every token,
 * so existing indexes must be rebuilt.
 */
@ConfigurationProperties(prefix = "app.secrets.blind-index")
public record BlindIndexProps(
        Integer cost,
        Integer blockSize,
        Integer parallelism
) {

    public BlindIndexProps {
        cost = cost == null ? 16384 : cost;
        blockSize = blockSize == null ? 8 : blockSize;
        parallelism = parallelism == null ? 1 : parallelism;
    }
}
