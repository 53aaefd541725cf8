package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.exception.TransientProviderException;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>재시도 루프 내부에서는 다음 시도를 예약하는 신호이고, 루프가 반환한 경우에는
 * 재시도 예산({@code maxAttempts})을 모두 소진했음을 의미합니다.</p>
 *
 * @param error 마지막 일시적 오류
 * @param attempts 현재까지 시도 횟수 (1 이상)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Retry<R>(
    TransientProviderException error,
    int attempts
) implements Outcome<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
