package com.ryuqq.relay.core.spi;

import java.time.Duration;

/**
 * 재시도 간 대기 SPI.
 *
 * <p>호출 스레드만 대기시키며, 인터럽트 시 {@link InterruptedException}을 던져야 합니다.
 * 테스트에서는 실제로 대기하지 않고 지연을 기록하는 구현으로 교체합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정 시간 동안 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;
}
