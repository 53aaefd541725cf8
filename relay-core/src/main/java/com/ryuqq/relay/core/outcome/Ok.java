package com.ryuqq.relay.core.outcome;

/**
 * 성공 결과.
 *
 * <p>{@code fromCache}가 true이면 Provider가 아닌 호출자의 캐시 조회 훅에서 얻은 값으로,
 * 재시도를 조기 종료했음을 의미합니다. 이 경우 Circuit Breaker는 성공으로 기록하지 않습니다.</p>
 *
 * @param value 응답 값
 * @param attempts Provider 호출 횟수 (1 이상)
 * @param fromCache 캐시 훅에서 얻은 값인지 여부
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Ok<R>(
    R value,
    int attempts,
    boolean fromCache
) implements Outcome<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attempts가 1 미만인 경우
     */
    public Ok {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    /**
     * Provider 응답으로 성공 결과 생성.
     *
     * @param value 응답 값
     * @param attempts Provider 호출 횟수
     * @return Ok 인스턴스
     */
    public static <R> Ok<R> of(R value, int attempts) {
        return new Ok<>(value, attempts, false);
    }

    /**
     * 캐시 훅 값으로 성공 결과 생성.
     *
     * @param value 캐시된 값
     * @param attempts 캐시 조회 전까지의 Provider 호출 횟수
     * @return Ok 인스턴스
     */
    public static <R> Ok<R> cached(R value, int attempts) {
        return new Ok<>(value, attempts, true);
    }
}
