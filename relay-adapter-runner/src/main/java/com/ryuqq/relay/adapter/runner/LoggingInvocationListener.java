package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.outcome.AttemptResult;
import com.ryuqq.relay.core.outcome.InvocationAttempt;
import com.ryuqq.relay.core.spi.InvocationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 시도 결과를 SLF4J로 기록하는 InvocationListener.
 *
 * <p>성공은 DEBUG, 실패는 INFO 레벨로 기록합니다. 재시도 예약과 Provider 실패 경고는
 * {@link RetryPolicy}와 {@link FallbackInvoker}가 별도로 기록합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class LoggingInvocationListener implements InvocationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingInvocationListener.class);

    @Override
    public void onAttempt(InvocationAttempt attempt) {
        if (attempt.result() == AttemptResult.SUCCESS) {
            log.debug("Attempt {} on {} for {} succeeded in {}ms",
                attempt.attemptIndex() + 1, attempt.providerName(), attempt.capability(), attempt.elapsed().toMillis());
        } else {
            log.info("Attempt {} on {} for {} ended with {} in {}ms",
                attempt.attemptIndex() + 1, attempt.providerName(), attempt.capability(), attempt.result(),
                attempt.elapsed().toMillis());
        }
    }
}
