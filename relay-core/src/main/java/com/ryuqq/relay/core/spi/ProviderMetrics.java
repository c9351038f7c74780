package com.ryuqq.relay.core.spi;

/**
 * 관측 지표 싱크 SPI.
 *
 * <p>Provider 계층은 이름 붙은 카운터만 증가시킵니다. 실제 저장소(로그, 메트릭 백엔드)는 어댑터가 결정합니다.</p>
 *
 * <p><strong>사용하는 카운터 이름:</strong></p>
 * <ul>
 *   <li>{@code retry}: 재시도 1회 (RetryConfig.trackMetrics가 켜진 경우)</li>
 *   <li>{@code complete}, {@code acomplete}, {@code embed}, {@code aembed}: 작업 실패 1회</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong> Thread-safe 해야 하며, 예외를 던지지 않아야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface ProviderMetrics {

    /**
     * 카운터 1 증가.
     *
     * @param counter 카운터 이름
     */
    void increment(String counter);
}
