/**
 * 예외 분류 체계.
 *
 * <pre>
 * RelayException (unchecked, errorCode + FailureCategory)
 *   ├─ ConfigurationException ─ DuplicateProviderException
 *   ├─ ProviderNotFoundException
 *   ├─ ProviderException
 *   │    ├─ TransientProviderException      (재시도 대상)
 *   │    ├─ PermanentProviderException      (재시도 불가) ─ InvalidResponseException
 *   │    └─ CircuitOpenException            (호출 생략)
 *   ├─ AllProvidersFailedException          (체인 전체 실패, ProviderFailure 목록)
 *   └─ InvocationCancelledException         (호출자 취소)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.exception;
