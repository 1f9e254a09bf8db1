package com.susanoo.backend.modules.auth.infrastructure.metrics;

import com.susanoo.backend.modules.auth.application.session.SessionEvent;
import com.susanoo.backend.modules.auth.application.session.SessionEventType;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Session counters fed from {@link SessionEvent}s. The session services never see the
 * registry.
 */
@Component
public class SessionMetricsListener {

    static final String EVENTS_METRIC = "susanoo.session.events";
    static final String INVALIDATED_METRIC = "susanoo.session.invalidated";

    private final MeterRegistry meterRegistry;

    public SessionMetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onSessionEvent(SessionEvent event) {
        Counter.builder(EVENTS_METRIC)
                .description("Session lifecycle events by type and outcome")
                .tag("type", event.type().name())
                .tag("outcome", event.outcome())
                .register(meterRegistry)
                .increment();

        if (event.type() == SessionEventType.INVALIDATED && event.affected() > 0) {
            Counter.builder(INVALIDATED_METRIC)
                    .description("Sessions removed by invalidation reason")
                    .tag("reason", event.outcome())
                    .register(meterRegistry)
                    .increment(event.affected());
        }
    }
}
