package com.ryuqq.relay.core.spi;

/**
 * 응답 유효성 검증 SPI.
 *
 * <p>예외 없이 반환된 응답이라도 검증에 실패하면(빈 데이터, 잘못된 페이로드 등)
 * Fallback 관점에서 실패로 취급되고 Circuit Breaker 실패로 집계됩니다.</p>
 *
 * @param <R> 응답 타입
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResponseValidator<R> {

    /**
     * 응답 검증.
     *
     * @param response Provider 응답 (null일 수 있음)
     * @return 유효하면 true
     */
    boolean isValid(R response);

    /**
     * null이 아닌 모든 응답을 허용하는 기본 검증기.
     *
     * @param <R> 응답 타입
     * @return 기본 검증기
     */
    static <R> ResponseValidator<R> nonNull() {
        return response -> response != null;
    }
}
