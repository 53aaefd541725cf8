package com.ryuqq.relay.core.model;

/**
 * 논리적 기능(Capability) 태그.
 *
 * <p>여러 Provider가 교체 가능하게 제공하는 하나의 논리적 기능을 나타냅니다
 * (예: {@code llm.deep-think}, {@code data.equity-quote}).</p>
 *
 * <p>타입 파라미터는 호출 시 전달되는 요청 페이로드({@code Q})와 응답({@code R})의 타입으로,
 * {@code invoke(capability, payload)} 호출을 컴파일 타임에 타입 안전하게 만듭니다.
 * 동등성은 이름으로만 판단하므로, 동일한 이름에 서로 다른 타입 파라미터를 사용하면 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Capability<String, String> quickLlm = Capability.of("llm.quick");
 * Capability<QuoteRequest, Quote> equityQuote = Capability.of("data.equity-quote");
 * }</pre>
 *
 * @param <Q> 요청 페이로드 타입
 * @param <R> 응답 타입
 * @author Relay Team
 * @since 1.0.0
 */
public final class Capability<Q, R> {

    private final String name;

    private Capability(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability name cannot be null or blank");
        }
        if (name.length() > 255) {
            throw new IllegalArgumentException("Capability name length cannot exceed 255 characters");
        }
        if (!name.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("Capability name contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.name = name;
    }

    /**
     * Capability 생성.
     *
     * @param name Capability 이름
     * @param <Q> 요청 페이로드 타입
     * @param <R> 응답 타입
     * @return Capability 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static <Q, R> Capability<Q, R> of(String name) {
        return new Capability<>(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Capability<?, ?> that = (Capability<?, ?>) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
