package com.ryuqq.relay.core.spi;

/**
 * Provider 호출 함수 SPI.
 *
 * <p>연동 코드가 벤더별로 구현하는 단일 호출 인터페이스입니다. 내부에서 벤더 HTTP/SDK 호출을 수행할 수 있으며,
 * Relay는 요청/응답 페이로드를 해석하지 않습니다.</p>
 *
 * <p><strong>예외 규약:</strong></p>
 * <ul>
 *   <li>재시도 가능 여부를 아는 경우 {@code TransientProviderException} 또는
 *       {@code PermanentProviderException}을 던집니다.</li>
 *   <li>그 외 예외는 {@code ErrorClassifier}가 분류합니다.</li>
 *   <li>{@link InterruptedException}은 호출 취소로 취급됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ProviderFunction<String, String> deepseek = prompt -> deepseekClient.complete(prompt);
 * }</pre>
 *
 * @param <Q> 요청 페이로드 타입
 * @param <R> 응답 타입
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProviderFunction<Q, R> {

    /**
     * Provider 호출.
     *
     * @param payload 요청 페이로드
     * @return 응답
     * @throws Exception 호출 실패 시
     */
    R call(Q payload) throws Exception;
}
