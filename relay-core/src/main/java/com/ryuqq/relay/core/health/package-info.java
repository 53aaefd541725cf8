/**
 * Health reporting model.
 *
 * <p>Snapshots are produced by a poller reading circuit breaker metrics and optional liveness
 * probes. They are read-only reports and never feed back into breaker state.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.health;
