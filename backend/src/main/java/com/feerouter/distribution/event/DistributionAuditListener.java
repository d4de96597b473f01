package com.feerouter.distribution.event;

import com.feerouter.config.AsyncConfig;
import com.feerouter.domain.DistributionEventRecord;
import com.feerouter.domain.DistributionEventRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;

/**
 * Appends committed distribution events to the audit log. Runs after commit on the events executor, so a
 * rolled-back page never leaves a record and a slow audit write never delays a crank.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DistributionAuditListener {

    private final DistributionEventRecordRepository eventRecordRepository;

    @Async(AsyncConfig.EVENTS_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onDistributionEvent(DistributionEvent event) {
        DistributionEventRecord record = new DistributionEventRecord();
        record.setVault(event.getVault());
        record.setType(event.type());
        record.setAttributes(new LinkedHashMap<>(event.attributes()));
        record.setOccurredAt(event.getOccurredAt());
        try {
            eventRecordRepository.save(record);
            log.debug("Recorded {} for vault {}", event.type(), event.getVault());
        } catch (RuntimeException e) {
            log.error("Failed to record {} for vault {}: {}", event.type(), event.getVault(), e.getMessage(), e);
        }
    }
}
