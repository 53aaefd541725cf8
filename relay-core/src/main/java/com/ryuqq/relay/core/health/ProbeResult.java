package com.ryuqq.relay.core.health;

/**
 * Liveness Probe 실행 결과.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ProbeResult {

    /** Probe 성공. */
    ALIVE,

    /** Probe가 false를 반환했거나 예외를 던짐. */
    FAILED,

    /** Probe 미설정 또는 Probe 실행 비활성화. */
    SKIPPED
}
