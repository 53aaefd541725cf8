package com.ryuqq.relay.core.health;

/**
 * Provider 헬스 분류.
 *
 * <p><strong>분류 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>DEGRADED: OPEN 상태가 유예 기간(openGracePeriod)보다 오래 지속</li>
 *   <li>OPEN: 유예 기간 이내의 OPEN</li>
 *   <li>HALF_OPEN: 복구 시험 중</li>
 *   <li>PROBE_FAILED: CLOSED지만 Liveness Probe 실패</li>
 *   <li>HEALTHY: 그 외</li>
 * </ol>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ProviderStatus {

    HEALTHY,

    OPEN,

    DEGRADED,

    HALF_OPEN,

    PROBE_FAILED;

    /**
     * 요청을 처리할 수 있는 상태인지 확인.
     *
     * @return HEALTHY 또는 HALF_OPEN이면 true
     */
    public boolean isUsable() {
        return this == HEALTHY || this == HALF_OPEN;
    }
}
