/**
 * In-Memory Provider Registry 구현.
 *
 * <p>Descriptor와 Circuit Breaker를 프로세스 메모리에 보관합니다.
 * 테스트마다 새 Registry를 생성하면 Circuit Breaker 상태가 격리됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.registry;
