package com.ryuqq.relay.core.registry;

import com.ryuqq.relay.core.model.Capability;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.retry.RetryConfig;
import com.ryuqq.relay.core.spi.LivenessProbe;
import com.ryuqq.relay.core.spi.ProviderFunction;
import com.ryuqq.relay.core.spi.ResponseValidator;

import java.util.Optional;

/**
 * Provider 등록 정보 (불변 record).
 *
 * <p>하나의 Capability를 제공하는 구체 Provider 하나를 기술합니다.
 * 동일한 Provider 이름을 여러 Capability에 등록할 수 있으며, 이 경우 Circuit Breaker를 공유합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>name: Provider 이름 (Circuit Breaker 식별자)</li>
 *   <li>capability: 제공하는 Capability</li>
 *   <li>rank: Fallback 체인 내 우선순위 (낮을수록 우선)</li>
 *   <li>function: 실제 벤더 호출 함수</li>
 *   <li>validator: 응답 검증기 (기본: null이 아닌 응답 허용)</li>
 *   <li>probe: Liveness Probe (선택, null 허용)</li>
 *   <li>retryConfig: Provider 전용 재시도 설정 (선택, null이면 Capability 설정 사용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Capability<String, String> quick = Capability.of("llm.quick");
 *
 * ProviderDescriptor<String, String> deepseek = ProviderDescriptor
 *     .of(quick, ProviderName.of("deepseek"), 0, prompt -> client.complete(prompt))
 *     .withValidator(answer -> !answer.isBlank())
 *     .withRetryConfig(new RetryConfig().withMaxAttempts(2));
 * }</pre>
 *
 * @param <Q> 요청 페이로드 타입
 * @param <R> 응답 타입
 * @param name Provider 이름
 * @param capability Capability
 * @param rank 우선순위
 * @param function Provider 함수
 * @param validator 응답 검증기
 * @param probe Liveness Probe (nullable)
 * @param retryConfig 재시도 설정 override (nullable)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ProviderDescriptor<Q, R>(
    ProviderName name,
    Capability<Q, R> capability,
    int rank,
    ProviderFunction<Q, R> function,
    ResponseValidator<R> validator,
    LivenessProbe probe,
    RetryConfig retryConfig
) {

    public ProviderDescriptor {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        if (validator == null) {
            validator = ResponseValidator.nonNull();
        }
    }

    /**
     * 필수 항목만으로 Descriptor 생성.
     *
     * @param capability Capability
     * @param name Provider 이름
     * @param rank 우선순위 (낮을수록 우선)
     * @param function Provider 함수
     * @return 기본 검증기, Probe 없음, 재시도 override 없음
     */
    public static <Q, R> ProviderDescriptor<Q, R> of(
        Capability<Q, R> capability,
        ProviderName name,
        int rank,
        ProviderFunction<Q, R> function
    ) {
        return new ProviderDescriptor<>(name, capability, rank, function, null, null, null);
    }

    public ProviderDescriptor<Q, R> withValidator(ResponseValidator<R> validator) {
        return new ProviderDescriptor<>(name, capability, rank, function, validator, probe, retryConfig);
    }

    public ProviderDescriptor<Q, R> withProbe(LivenessProbe probe) {
        return new ProviderDescriptor<>(name, capability, rank, function, validator, probe, retryConfig);
    }

    public ProviderDescriptor<Q, R> withRetryConfig(RetryConfig retryConfig) {
        return new ProviderDescriptor<>(name, capability, rank, function, validator, probe, retryConfig);
    }

    public ProviderDescriptor<Q, R> withRank(int rank) {
        return new ProviderDescriptor<>(name, capability, rank, function, validator, probe, retryConfig);
    }

    /**
     * Provider 전용 재시도 설정.
     *
     * @return override가 있으면 해당 설정, 없으면 empty
     */
    public Optional<RetryConfig> retryOverride() {
        return Optional.ofNullable(retryConfig);
    }

    /**
     * Liveness Probe 보유 여부.
     *
     * @return Probe가 설정되어 있으면 true
     */
    public boolean hasProbe() {
        return probe != null;
    }
}
