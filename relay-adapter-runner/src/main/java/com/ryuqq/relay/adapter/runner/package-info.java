/**
 * Relay runner 어댑터.
 *
 * <p>Provider 호출 보호 체인과 헬스 집계를 실행하는 구현체를 제공합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.runner.FallbackInvoker} - ProviderInvoker 구현 (Fallback 체인)</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.RetryPolicy} - Provider 1건에 대한 재시도 루프</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.BackoffCalculator} - Exponential Backoff with Jitter</li>
 *   <li>{@link com.ryuqq.relay.adapter.runner.HealthAggregator} - HealthQuery 구현 (주기적 폴링)</li>
 * </ul>
 *
 * <p><strong>보호 체인:</strong></p>
 * <pre>
 * FallbackInvoker
 *   └─ for provider in registry.listFor(capability):
 *        CircuitBreaker.execute(
 *            RetryPolicy.execute(
 *                ProviderFunction.call(payload)))
 * </pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner;
