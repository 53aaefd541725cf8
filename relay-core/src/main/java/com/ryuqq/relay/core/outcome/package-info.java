/**
 * Provider invocation outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for per-provider results,
 * returned by every layer of the invocation path instead of exception-driven control flow.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.outcome.Ok} - Successful response (or cached short-circuit)</li>
 *   <li>{@link com.ryuqq.relay.core.outcome.Retry} - Transient failure (retryable, or exhausted when returned)</li>
 *   <li>{@link com.ryuqq.relay.core.outcome.Fail} - Permanent failure, invalid response or circuit rejection</li>
 * </ul>
 *
 * <h2>Telemetry</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.outcome.InvocationAttempt} - One attempt, delivered to listeners only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.outcome;
