package com.onevault.accessservice.infrastructure.audit;

import com.onevault.audit.AuditPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically hands audit records that failed delivery back to the sink. Records still failing
 * stay queued for the next run.
 */
@Component
public class AuditRedeliveryJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRedeliveryJob.class);

    private final AuditPublisher publisher;

    public AuditRedeliveryJob(AuditPublisher publisher) {
        this.publisher = publisher;
    }

    @Scheduled(fixedDelayString = "${onevault.access.audit.retry-interval:PT10S}")
    public void redeliver() {
        if (publisher.pendingCount() == 0) {
            return;
        }
        publisher.retryPending();
        int remaining = publisher.pendingCount();
        if (remaining > 0) {
            log.warn("Audit sink still failing, {} records pending redelivery", remaining);
        }
    }
}
