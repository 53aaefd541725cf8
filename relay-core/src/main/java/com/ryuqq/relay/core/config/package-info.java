/**
 * Relay 설정 패키지.
 *
 * <p>{@link com.ryuqq.relay.core.config.RelaySettings}는 시작 시 한 번 구성되는 불변 설정이며,
 * {@link com.ryuqq.relay.core.config.RelaySettingsLoader}가 properties와 환경 변수로부터 생성합니다.</p>
 *
 * <pre>
 * relay.defaults.retry.max-attempts=3
 * relay.defaults.breaker.failure-threshold=5
 * relay.capabilities.llm.quick.retry.max-attempts=2
 * relay.health.poll-interval-ms=30000
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.config;
