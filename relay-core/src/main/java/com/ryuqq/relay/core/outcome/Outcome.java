package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.exception.ProviderException;

/**
 * Provider 호출 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 (응답 값 보유)</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패 또는 호출 거부, 재시도 불가</li>
 * </ul>
 *
 * <p>각 계층(RetryPolicy, CircuitBreaker, FallbackInvoker)은 예외 대신 Outcome 값을 반환하여
 * 재시도/차단/폴백 결정을 명시적으로 표현합니다. 예외는 연동 코드 경계와
 * 호출자에게 전달되는 최종 실패에서만 사용합니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * @param <R> 응답 타입
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface Outcome<R> permits Ok, Retry, Fail {

    /**
     * Provider 함수 호출 횟수.
     *
     * @return 호출 횟수 (Circuit OPEN으로 생략된 경우 0)
     */
    int attempts();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 실패 원인 조회.
     *
     * @return Retry/Fail의 오류, Ok인 경우 null
     */
    default ProviderException errorOrNull() {
        if (this instanceof Retry<R> retry) {
            return retry.error();
        }
        if (this instanceof Fail<R> fail) {
            return fail.error();
        }
        return null;
    }
}
