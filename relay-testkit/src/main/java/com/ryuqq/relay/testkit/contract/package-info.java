/**
 * Contract test suites that SPI implementations extend.
 *
 * <p>{@link com.ryuqq.relay.testkit.contract.AbstractCircuitBreakerContractTest} verifies the
 * circuit breaker state machine against a manual clock.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.contract;
