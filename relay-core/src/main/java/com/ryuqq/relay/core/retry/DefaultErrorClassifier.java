package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.exception.PermanentProviderException;
import com.ryuqq.relay.core.exception.TransientProviderException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * 기본 오류 분류기.
 *
 * <p><strong>분류 규칙 (위에서부터 적용):</strong></p>
 * <ol>
 *   <li>{@link TransientProviderException} → TRANSIENT</li>
 *   <li>{@link PermanentProviderException} → PERMANENT</li>
 *   <li>{@link IOException} (연결 실패, 소켓 타임아웃 포함), {@link UncheckedIOException},
 *       {@link TimeoutException} → TRANSIENT</li>
 *   <li>그 외 → PERMANENT</li>
 * </ol>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class DefaultErrorClassifier implements ErrorClassifier {

    @Override
    public FailureKind classify(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (error instanceof TransientProviderException) {
            return FailureKind.TRANSIENT;
        }
        if (error instanceof PermanentProviderException) {
            return FailureKind.PERMANENT;
        }
        if (error instanceof IOException
            || error instanceof UncheckedIOException
            || error instanceof TimeoutException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }
}
