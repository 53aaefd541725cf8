package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.InvocationCancelledException;
import com.ryuqq.relay.core.model.ProviderName;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.spi.ProviderFunction;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>Provider 하나의 연속 실패를 추적하고, 임계값 도달 시 호출을 즉시 거부(Fail-Fast)하여
 * 장애가 난 Provider로 트래픽이 계속 흐르지 않도록 합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 횟수 추적</li>
 *   <li>OPEN: 요청 차단, Provider 호출 없이 즉시 실패</li>
 *   <li>HALF_OPEN: 단 하나의 시험 호출로 복구 여부 확인</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 상태 전이(확인 후 변경)를 인스턴스 단위 상호 배제 안에서 수행해야 하며,
 * Provider 호출 중에는 락을 잡고 있으면 안 됩니다. 서로 다른 Provider의 호출을 직렬화하는 전역 락은 금지됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.circuitBreaker(ProviderName.of("deepseek"));
 *
 * CircuitBreakerPermit permit = cb.tryAcquire()
 *     .orElseThrow(() -> new CircuitOpenException(cb.providerName()));
 *
 * try {
 *     String answer = client.complete(prompt);
 *     cb.recordSuccess(permit);
 *     return answer;
 * } catch (Exception e) {
 *     cb.recordFailure(permit, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>위 절차는 {@link #call(ProviderFunction, Object)}(예외 기반)와
 * {@link #execute(Supplier)}(Outcome 기반)로 제공됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 Provider 이름.
     *
     * @return Provider 이름
     */
    ProviderName providerName();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 permit 발급</li>
     *   <li>OPEN: openTimeout 경과 전 empty, 경과 후 HALF_OPEN으로 전이하고 시험 호출 permit 발급</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 없을 때만 시험 호출 permit 발급</li>
     * </ul>
     *
     * <p>permit을 받은 호출자는 반드시 {@link #recordSuccess(CircuitBreakerPermit)},
     * {@link #recordFailure(CircuitBreakerPermit, Throwable)}, {@link #releasePermit(CircuitBreakerPermit)}
     * 중 하나를 정확히 한 번 호출해야 합니다.</p>
     *
     * @return 허용 시 permit, 차단 시 empty
     */
    Optional<CircuitBreakerPermit> tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 0으로 초기화</li>
     *   <li>HALF_OPEN + 시험 호출 permit: CLOSED로 전이, 연속 실패 횟수 초기화</li>
     *   <li>HALF_OPEN + 이전 permit, OPEN: 무시</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}가 발급한 permit
     */
    void recordSuccess(CircuitBreakerPermit permit);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN + 시험 호출 permit: 즉시 OPEN으로 전이, 마지막 실패 시각 갱신</li>
     *   <li>HALF_OPEN + 이전 permit, OPEN: 연속 실패 횟수만 증가</li>
     * </ul>
     *
     * @param permit {@link #tryAcquire()}가 발급한 permit
     * @param throwable 발생한 오류 (null 허용)
     */
    void recordFailure(CircuitBreakerPermit permit, Throwable throwable);

    /**
     * 허용된 호출이 성공도 실패도 아닌 상태로 끝났음을 기록 (예: 취소).
     *
     * <p>카운터와 시각은 변경하지 않고, 시험 호출 permit이면 HALF_OPEN 시험 호출 슬롯만 반환합니다.</p>
     *
     * @param permit {@link #tryAcquire()}가 발급한 permit
     */
    void releasePermit(CircuitBreakerPermit permit);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 상태 스냅샷 조회 (헬스 리포트용).
     *
     * @return 일관된 시점의 불변 스냅샷
     */
    CircuitBreakerMetrics metrics();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * Provider 함수를 Circuit Breaker로 보호하여 호출.
     *
     * @param function Provider 함수
     * @param payload 요청 페이로드
     * @return Provider 응답 (성공 기록 후 반환)
     * @throws CircuitOpenException OPEN 상태로 Provider를 호출하지 않은 경우
     * @throws InvocationCancelledException 호출 중 인터럽트된 경우 (상태 변경 없음)
     * @throws Exception Provider가 던진 예외 (실패 기록 후 그대로 전파)
     */
    default <Q, R> R call(ProviderFunction<Q, R> function, Q payload) throws Exception {
        Optional<CircuitBreakerPermit> acquired = tryAcquire();
        if (acquired.isEmpty()) {
            throw new CircuitOpenException(providerName());
        }
        CircuitBreakerPermit permit = acquired.get();
        boolean settled = false;
        try {
            R result = function.call(payload);
            recordSuccess(permit);
            settled = true;
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationCancelledException("Call to " + providerName() + " was interrupted", e);
        } catch (Exception e) {
            recordFailure(permit, e);
            settled = true;
            throw e;
        } finally {
            if (!settled) {
                releasePermit(permit);
            }
        }
    }

    /**
     * Outcome을 반환하는 호출(재시도 루프 전체)을 Circuit Breaker로 보호하여 실행.
     *
     * <p>호출 결과당 정확히 한 번 상태를 변경합니다:</p>
     * <ul>
     *   <li>OPEN 거부: Provider 미호출, {@link Fail#rejected(CircuitOpenException)} 반환, 상태 변경 없음</li>
     *   <li>{@link Ok}: 성공 기록 (캐시 훅 결과인 경우 permit만 반환)</li>
     *   <li>Retry / Fail: 실패 기록</li>
     *   <li>{@link InvocationCancelledException}: permit만 반환 후 전파</li>
     * </ul>
     *
     * @param guarded 보호할 호출
     * @return 호출 결과 또는 거부 결과
     */
    default <R> Outcome<R> execute(Supplier<Outcome<R>> guarded) {
        Optional<CircuitBreakerPermit> acquired = tryAcquire();
        if (acquired.isEmpty()) {
            return Fail.rejected(new CircuitOpenException(providerName()));
        }
        CircuitBreakerPermit permit = acquired.get();
        boolean settled = false;
        try {
            Outcome<R> outcome = guarded.get();
            if (outcome instanceof Ok<R> ok) {
                if (ok.fromCache()) {
                    releasePermit(permit);
                } else {
                    recordSuccess(permit);
                }
            } else {
                recordFailure(permit, outcome.errorOrNull());
            }
            settled = true;
            return outcome;
        } catch (InvocationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(permit, e);
            settled = true;
            throw e;
        } finally {
            if (!settled) {
                releasePermit(permit);
            }
        }
    }
}
