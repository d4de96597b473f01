package com.feerouter.distribution.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Base of events published by setup, position bootstrap and crank pages. Listeners only see them after the
 * publishing transaction commits.
 */
@Getter
public abstract class DistributionEvent extends ApplicationEvent {

    private final String vault;
    private final Instant occurredAt;

    protected DistributionEvent(Object source, String vault, Instant occurredAt) {
        super(source);
        this.vault = vault;
        this.occurredAt = occurredAt;
    }

    /** Stable name stored in the audit log. */
    public abstract String type();

    /** Event-specific fields for the audit log. */
    public abstract Map<String, Object> attributes();
}
