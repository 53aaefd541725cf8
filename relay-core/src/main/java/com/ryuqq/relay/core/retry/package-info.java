/**
 * 재시도 설정 및 오류 분류 패키지.
 *
 * <p>지연 계산과 재시도 루프 실행은 {@code relay-adapter-runner} 모듈의
 * {@code BackoffCalculator}, {@code RetryPolicy}가 담당합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.retry;
