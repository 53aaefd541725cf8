package com.ryuqq.relay.application.invoker;

import com.ryuqq.relay.core.exception.AllProvidersFailedException;
import com.ryuqq.relay.core.exception.ConfigurationException;
import com.ryuqq.relay.core.exception.InvocationCancelledException;
import com.ryuqq.relay.core.model.Capability;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Capability 호출 진입점.
 *
 * <p>호출자는 어떤 Provider가 요청을 처리할지 알지 못한 채 논리적 요청을 보냅니다.
 * 구현체는 Provider를 순위대로 선택하고, Circuit Breaker와 재시도로 보호하며, 실패 시 다음 Provider로 넘어갑니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Capability&lt;String, String&gt; quick = Capability.of("llm.quick");
 *
 * try {
 *     String answer = invoker.invoke(quick, "Summarize AAPL earnings");
 * } catch (AllProvidersFailedException e) {
 *     // 모든 Provider 실패: Provider별 실패 사유 확인
 *     e.getFailures().forEach(f -&gt; log.warn(f.describe()));
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> 호출 스레드만 블로킹하며, 여러 호출자가 동시에 호출할 수 있습니다.
 * 호출 스레드 인터럽트(예: {@code Future.cancel(true)})로 호출을 취소할 수 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface ProviderInvoker {

    /**
     * Capability 호출.
     *
     * @param capability 호출할 Capability
     * @param payload 요청 페이로드
     * @return 첫 번째로 성공한 Provider의 응답
     * @throws ConfigurationException 등록된 Provider가 없는 경우
     * @throws AllProvidersFailedException 모든 Provider가 실패한 경우 (체인 순서의 실패 목록 포함)
     * @throws InvocationCancelledException 호출 스레드가 인터럽트된 경우
     */
    default <Q, R> R invoke(Capability<Q, R> capability, Q payload) {
        return invoke(capability, payload, Optional::empty);
    }

    /**
     * 캐시 훅을 사용하는 Capability 호출.
     *
     * <p>{@code cachedResponse}는 재시도 대기 직전마다 조회되며, 값이 있으면 재시도를 중단하고
     * 해당 값을 반환합니다. 이 경우 Circuit Breaker 상태는 변경되지 않습니다.</p>
     *
     * @param capability 호출할 Capability
     * @param payload 요청 페이로드
     * @param cachedResponse 호출자가 보유한 캐시 응답 조회 훅
     * @return Provider 응답 또는 캐시 응답
     * @throws ConfigurationException 등록된 Provider가 없는 경우
     * @throws AllProvidersFailedException 모든 Provider가 실패한 경우
     * @throws InvocationCancelledException 호출 스레드가 인터럽트된 경우
     */
    <Q, R> R invoke(Capability<Q, R> capability, Q payload, Supplier<Optional<R>> cachedResponse);
}
