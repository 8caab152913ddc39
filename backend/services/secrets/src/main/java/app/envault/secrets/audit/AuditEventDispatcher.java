package app.envault.secrets.audit;

import app.envault.secrets.config.AsyncConfig;
import app.envault.secrets.config.AuditProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Hands committed audit events to every {@link AuditSink} on the audit executor. Events of rolled back
 * transactions are dropped. Failures are retried a bounded number of times and then only logged.
 * Events rejected by a full executor are logged by {@link DroppedAuditEventHandler}.
 */
@Component
public class AuditEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AuditEventDispatcher.class);

    private final List<AuditSink> sinks;
    private final TaskExecutor executor;
    private final int maxAttempts;
    private final long backoffMs;

    public AuditEventDispatcher(List<AuditSink> sinks,
                                AuditProps props,
                                @Qualifier(AsyncConfig.AUDIT_EXECUTOR) TaskExecutor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
        this.maxAttempts = Math.max(props.maxAttempts(), 1);
        this.backoffMs = Math.max(props.backoffMs(), 0L);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAuditEvent(AuditEvent event) {
        executor.execute(new AuditDelivery(event, this::deliverToAll));
    }

    void deliverToAll(AuditEvent event) {
        for (AuditSink sink : sinks) {
            deliver(sink, event);
        }
    }

    void deliver(AuditSink sink, AuditEvent event) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sink.log(event);
                return;
            } catch (RuntimeException ex) {
                if (attempt == maxAttempts) {
                    log.error("Audit delivery failed eventId={} action={} sink={} attempts={}",
                            event.eventId(), event.action().code(), sink.getClass().getSimpleName(), attempt, ex);
                    return;
                }
                log.warn("Audit delivery attempt failed eventId={} sink={} attempt={} errorType={}",
                        event.eventId(), sink.getClass().getSimpleName(), attempt, ex.getClass().getSimpleName());
                if (!sleep(backoffMs * attempt)) {
                    return;
                }
            }
        }
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Audit delivery interrupted while backing off");
            return false;
        }
    }
}
