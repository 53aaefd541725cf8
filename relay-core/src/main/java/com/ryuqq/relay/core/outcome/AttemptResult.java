package com.ryuqq.relay.core.outcome;

/**
 * 단일 시도의 결과 분류.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum AttemptResult {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE
}
