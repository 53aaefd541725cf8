/**
 * Provider 호출 포트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.application.invoker.ProviderInvoker} - Fallback 체인 기반 Capability 호출 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code FallbackInvoker}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.application.invoker;
