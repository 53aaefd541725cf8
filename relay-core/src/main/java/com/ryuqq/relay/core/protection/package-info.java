/**
 * Protection SPI 패키지.
 *
 * <p>Provider별 장애를 격리하기 위한 Circuit Breaker 확장점을 정의합니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <pre>
 * 1. CircuitBreaker  → OPEN 상태 시 Provider 호출 없이 즉시 거부
 * 2. RetryPolicy     → 일시적 오류에 대해 지수 백오프 + jitter로 재시도
 * 3. ProviderFunction → 실제 벤더 호출
 * </pre>
 *
 * <p>재시도 루프 전체가 Circuit Breaker 안에서 실행되므로, 재시도를 소진한 호출 1건은
 * Circuit Breaker 실패 1회로 집계됩니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@code noop.NoOpCircuitBreaker}: 항상 허용, 상태 추적 없음</li>
 *   <li>{@code relay-adapter-inmemory}의 {@code InMemoryCircuitBreaker}: 연속 실패 기반 상태 머신</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 * @see com.ryuqq.relay.core.protection.CircuitBreaker
 * @see com.ryuqq.relay.core.protection.noop.NoOpCircuitBreaker
 */
package com.ryuqq.relay.core.protection;
