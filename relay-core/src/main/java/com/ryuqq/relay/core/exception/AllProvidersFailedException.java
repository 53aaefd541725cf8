package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.Capability;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fallback 체인 전체 실패.
 *
 * <p>{@code invoke}의 최종 실패 결과로, 체인 순서대로 각 Provider의 실패 내역을 담습니다.
 * 호출자는 이를 받아 캐시/대체 결과로 저하 처리하거나 최종 사용자에게 전파합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class AllProvidersFailedException extends RelayException {

    public static final String ERROR_CODE = "RELAY-ALL-FAILED";

    private final Capability<?, ?> capability;
    private final List<ProviderFailure> failures;

    public AllProvidersFailedException(Capability<?, ?> capability, List<ProviderFailure> failures) {
        super(ERROR_CODE, FailureCategory.EXHAUSTED, buildMessage(capability, failures), lastCause(failures));
        this.capability = capability;
        this.failures = List.copyOf(failures);
    }

    public Capability<?, ?> getCapability() {
        return capability;
    }

    /**
     * 체인 순서대로 정렬된 Provider별 실패 목록.
     *
     * @return 불변 리스트
     */
    public List<ProviderFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(Capability<?, ?> capability, List<ProviderFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        return "All " + failures.size() + " provider(s) failed for capability " + capability + ": "
            + failures.stream().map(ProviderFailure::describe).collect(Collectors.joining("; "));
    }

    private static Throwable lastCause(List<ProviderFailure> failures) {
        return failures == null || failures.isEmpty() ? null : failures.get(failures.size() - 1).error();
    }
}
