/**
 * 구성 패키지.
 *
 * <p>Provider 계층의 모든 설정은 불변 record이며, compact constructor에서 값을 검증하고
 * 기본 생성자와 {@code withX} 복사 메서드를 제공합니다.
 * 중첩 Map 형태의 구성은 {@link com.ryuqq.relay.core.config.ProviderSettingsMapper}로 읽습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.config;
