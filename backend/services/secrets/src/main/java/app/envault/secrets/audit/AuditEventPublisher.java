package app.envault.secrets.audit;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Emits audit events from inside service transactions. Delivery happens after commit,
 * see {@link AuditEventDispatcher}.
 */
@Component
public class AuditEventPublisher {

    private final ApplicationEventPublisher publisher;

    public AuditEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(AuditEvent event) {
        publisher.publishEvent(event);
    }
}
