package com.openforge.agentcore.history;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the active history backend under /actuator/health as "historyStore".
 */
@Component("historyStore")
@RequiredArgsConstructor
public class HistoryStoreHealthIndicator implements HealthIndicator {

    private final HistoryStore historyStore;

    @Override
    public Health health() {
        try {
            historyStore.ping();
            return Health.up().withDetail("backend", historyStore.backendName()).build();
        } catch (StorageUnavailableException e) {
            return Health.down(e).withDetail("backend", historyStore.backendName()).build();
        }
    }
}
