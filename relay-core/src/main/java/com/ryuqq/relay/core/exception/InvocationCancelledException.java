package com.ryuqq.relay.core.exception;

/**
 * 호출 취소.
 *
 * <p>호출 스레드가 인터럽트되어 진행 중이던 시도 또는 재시도 대기가 중단된 경우 발생합니다.
 * 취소된 시도는 성공도 실패도 아니며 Circuit Breaker 상태를 변경하지 않습니다.
 * 발생 시점에 현재 스레드의 인터럽트 플래그는 복원되어 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InvocationCancelledException extends RelayException {

    public static final String ERROR_CODE = "RELAY-CANCELLED";

    public InvocationCancelledException(String message) {
        super(ERROR_CODE, FailureCategory.CANCELLED, message, null);
    }

    public InvocationCancelledException(String message, Throwable cause) {
        super(ERROR_CODE, FailureCategory.CANCELLED, message, cause);
    }
}
