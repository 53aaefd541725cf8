/**
 * 식별자 값 타입 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.model.Capability} - 논리적 기능 태그 (타입 안전한 호출 키)</li>
 *   <li>{@link com.ryuqq.relay.core.model.ProviderName} - Provider 식별자</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.model;
