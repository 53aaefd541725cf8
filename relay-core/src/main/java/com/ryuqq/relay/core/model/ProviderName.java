package com.ryuqq.relay.core.model;

/**
 * Provider의 안정적인 식별자.
 *
 * <p>하나의 백엔드(LLM 벤더 엔드포인트, 시세 데이터 소스 등)를 가리키며,
 * Circuit Breaker 인스턴스는 이 이름 단위로 하나씩 생성됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ProviderName {

    private final String value;

    private ProviderName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProviderName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ProviderName length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("ProviderName contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ProviderName 생성.
     *
     * @param value 이름
     * @return ProviderName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ProviderName of(String value) {
        return new ProviderName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderName that = (ProviderName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
