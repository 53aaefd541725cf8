package com.ryuqq.relay.core.exception;

/**
 * Relay 예외 계층의 최상위 타입.
 *
 * <p>모든 Relay 예외는 unchecked이며, 오류 코드와 {@link FailureCategory}를 가집니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class RelayException extends RuntimeException {

    private final String errorCode;
    private final FailureCategory category;

    protected RelayException(String errorCode, FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        this.errorCode = errorCode;
        this.category = category;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public FailureCategory getCategory() {
        return category;
    }

    /**
     * 최종 사용자에게 보여줄 수 있는 조치 안내.
     *
     * @return {@link FailureCategory#guidance()}
     */
    public String getGuidance() {
        return category.guidance();
    }
}
