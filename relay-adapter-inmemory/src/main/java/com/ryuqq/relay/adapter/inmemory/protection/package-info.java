/**
 * In-Memory Circuit Breaker 구현.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.inmemory.protection.InMemoryCircuitBreaker} - 인스턴스 락 기반 상태 머신</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.protection;
