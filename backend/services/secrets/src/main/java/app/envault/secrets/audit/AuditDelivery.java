package app.envault.secrets.audit;

import java.util.function.Consumer;

/**
 * Task queued on the audit executor. Carries its event so a rejected task can still be identified.
 */
record AuditDelivery(AuditEvent event, Consumer<AuditEvent> delivery) implements Runnable {

    @Override
    public void run() {
        delivery.accept(event);
    }
}
