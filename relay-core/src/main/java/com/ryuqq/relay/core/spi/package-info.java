/**
 * 연동 코드용 SPI (Service Provider Interface) 패키지.
 *
 * <p>Relay는 벤더별 구체 타입에 의존하지 않고, 아래 인터페이스에만 의존합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.ProviderFunction} - 벤더 호출 함수 {@code (payload) -> response}</li>
 *   <li>{@link com.ryuqq.relay.core.spi.ResponseValidator} - 응답 유효성 검증</li>
 *   <li>{@link com.ryuqq.relay.core.spi.LivenessProbe} - 헬스 폴링용 생존 확인</li>
 *   <li>{@link com.ryuqq.relay.core.spi.InvocationListener} - 시도 단위 텔레메트리</li>
 *   <li>{@link com.ryuqq.relay.core.spi.Sleeper} - 재시도 간 대기</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.spi;
