package com.ryuqq.relay.application.health;

import com.ryuqq.relay.core.health.HealthSnapshot;

/**
 * Provider health read port.
 *
 * <p>Returns the latest immutable snapshot produced by the health poller. Callers such as
 * readiness endpoints use {@link HealthSnapshot#isReady()}.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface HealthQuery {

    /**
     * Returns the most recent health snapshot.
     *
     * <p>If no poll has completed yet, implementations poll once before returning.</p>
     *
     * @return latest snapshot, never null
     */
    HealthSnapshot getHealth();
}
