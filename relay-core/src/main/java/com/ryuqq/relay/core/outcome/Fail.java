package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.FailureReason;
import com.ryuqq.relay.core.exception.ProviderException;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>인증 실패, 잘못된 요청 ({@link FailureReason#PERMANENT_ERROR})</li>
 *   <li>검증기가 응답을 거부 ({@link FailureReason#INVALID_RESPONSE})</li>
 *   <li>Circuit Breaker OPEN으로 호출 생략 ({@link FailureReason#CIRCUIT_OPEN})</li>
 * </ul>
 *
 * @param error 실패 원인
 * @param reason 실패 사유
 * @param attempts Provider 호출 횟수 (0 이상)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Fail<R>(
    ProviderException error,
    FailureReason reason,
    int attempts
) implements Outcome<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (reason == FailureReason.RETRIES_EXHAUSTED) {
            throw new IllegalArgumentException("RETRIES_EXHAUSTED is expressed by Retry, not Fail");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }

    /**
     * Circuit OPEN으로 호출이 거부된 결과 생성.
     *
     * @param error CircuitOpenException
     * @return Fail 인스턴스 (attempts=0)
     */
    public static <R> Fail<R> rejected(CircuitOpenException error) {
        return new Fail<>(error, FailureReason.CIRCUIT_OPEN, 0);
    }
}
