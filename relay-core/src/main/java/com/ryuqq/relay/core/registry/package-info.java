/**
 * Provider registry: descriptors, fallback chain ordering and circuit breaker ownership.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.registry;
