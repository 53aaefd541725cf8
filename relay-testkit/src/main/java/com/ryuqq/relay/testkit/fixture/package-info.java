/**
 * Deterministic test fixtures: scripted providers, a manual clock and a recording sleeper.
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.fixture;
