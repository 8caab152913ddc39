package app.envault.secrets.config;

import app.envault.secrets.audit.DroppedAuditEventHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String AUDIT_EXECUTOR = "auditExecutor";

    // Audit must never push back on request threads: a full queue rejects the new event and it is logged.
    @Bean(name = AUDIT_EXECUTOR)
    public ThreadPoolTaskExecutor auditExecutor(AuditProps props, DroppedAuditEventHandler droppedEvents) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(props.corePoolSize(), 1));
        executor.setMaxPoolSize(Math.max(props.maxPoolSize(), props.corePoolSize()));
        executor.setQueueCapacity(Math.max(props.queueCapacity(), 1));
        executor.setThreadNamePrefix("audit-");
        executor.setRejectedExecutionHandler(droppedEvents);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
