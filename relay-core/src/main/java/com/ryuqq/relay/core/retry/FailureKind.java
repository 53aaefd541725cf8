package com.ryuqq.relay.core.retry;

/**
 * 오류 분류 결과.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum FailureKind {

    /** 재시도로 해결될 수 있는 오류. */
    TRANSIENT,

    /** 같은 Provider에 재시도해도 해결되지 않는 오류. */
    PERMANENT
}
