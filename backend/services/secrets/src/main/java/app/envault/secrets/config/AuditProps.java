package app.envault.secrets.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.secrets.audit")
public record AuditProps(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity,
        Integer maxAttempts,
        Long backoffMs
) {

    public AuditProps {
        corePoolSize = corePoolSize == null ? 2 : corePoolSize;
        maxPoolSize = maxPoolSize == null ? 4 : maxPoolSize;
        queueCapacity = queueCapacity == null ? 10_000 : queueCapacity;
        maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        backoffMs = backoffMs == null ? 200L : backoffMs;
    }
}
