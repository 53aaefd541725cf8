package com.ryuqq.relay.core.retry;

/**
 * Provider 오류 분류 SPI.
 *
 * <p>연동 코드가 던진 임의의 예외를 재시도 가능 여부로 분류합니다.
 * 벤더 SDK 예외를 직접 분류해야 하는 경우 구현을 교체합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 * @see DefaultErrorClassifier
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * 예외 분류.
     *
     * @param error Provider 호출에서 발생한 예외 (null 불가)
     * @return TRANSIENT 또는 PERMANENT
     */
    FailureKind classify(Throwable error);
}
