package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.outcome.InvocationAttempt;

/**
 * 시도 단위 텔레메트리 SPI.
 *
 * <p>Provider 함수가 한 번 호출될 때마다 호출됩니다. 구현은 빠르게 반환해야 하며
 * 예외를 던지지 않아야 합니다 (던진 예외는 로그만 남기고 무시됩니다).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InvocationListener {

    /**
     * 시도 완료 통지.
     *
     * @param attempt 시도 기록
     */
    void onAttempt(InvocationAttempt attempt);

    /**
     * 아무것도 하지 않는 리스너.
     *
     * @return NoOp 리스너
     */
    static InvocationListener noOp() {
        return attempt -> {
            // NoOp
        };
    }
}
