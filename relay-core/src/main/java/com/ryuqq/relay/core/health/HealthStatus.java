package com.ryuqq.relay.core.health;

/**
 * 전체 헬스 상태.
 *
 * <ul>
 *   <li>HEALTHY: 모든 Provider가 HEALTHY</li>
 *   <li>DEGRADED: 일부 Provider가 HEALTHY가 아니지만 모든 Capability에 사용 가능한 Provider가 있음</li>
 *   <li>UNHEALTHY: 사용 가능한 Provider가 하나도 없는 Capability가 존재</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
