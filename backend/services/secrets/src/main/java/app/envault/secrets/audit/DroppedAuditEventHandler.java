package app.envault.secrets.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rejection policy of the audit executor. Audit never blocks the audited operation, so an event that finds
 * the queue full is dropped, but never silently: the full event is logged at ERROR for later replay.
 */
@Component
public class DroppedAuditEventHandler implements RejectedExecutionHandler {

    private static final Logger log = LoggerFactory.getLogger(DroppedAuditEventHandler.class);

    private final AtomicLong dropped = new AtomicLong();

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
        long total = dropped.incrementAndGet();
        if (task instanceof AuditDelivery delivery) {
            AuditEvent event = delivery.event();
            log.error("Audit event dropped eventId={} action={} organizationId={} actorId={} resourceType={} resourceId={} occurredAt={} queued={} droppedTotal={}",
                    event.eventId(), event.action().code(), event.organizationId(), event.actorId(),
                    event.resourceType(), event.resourceId(), event.occurredAt(), executor.getQueue().size(), total);
            return;
        }
        log.error("Audit task dropped taskType={} queued={} shutdown={} droppedTotal={}",
                task.getClass().getName(), executor.getQueue().size(), executor.isShutdown(), total);
    }

    public long droppedCount() {
        return dropped.get();
    }
}
