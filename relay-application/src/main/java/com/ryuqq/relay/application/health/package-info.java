/**
 * Health query port.
 *
 * <p>Implemented by {@code HealthAggregator} in the adapter-runner module.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.application.health;
