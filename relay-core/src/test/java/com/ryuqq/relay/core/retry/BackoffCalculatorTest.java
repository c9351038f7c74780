package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.config.RetryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("BackoffCalculator 테스트")
class BackoffCalculatorTest {

    private final RetryConfig noJitter = new RetryConfig()
        .withInitialDelay(Duration.ofSeconds(1))
        .withExponentialBase(2.0)
        .withMaxDelay(Duration.ofSeconds(60))
        .withJitter(false);

    @Test
    @DisplayName("jitter 비활성 시 initialDelay * base^(n-1)을 반환한다")
    void jitter_비활성_지수_증가() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(calculator.calculate(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(calculator.calculate(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("maxDelay를 넘지 않는다")
    void maxDelay_제한() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        // when & then
        assertThat(calculator.calculate(10)).isEqualTo(Duration.ofSeconds(60));
        assertThat(calculator.calculate(5000)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("jitter 활성 시 [bound/2, bound] 범위에서 선택한다")
    void jitter_범위() {
        // given
        RetryConfig config = noJitter.withJitter(true);
        BackoffCalculator lowest = new BackoffCalculator(config, () -> 0.0);
        BackoffCalculator highest = new BackoffCalculator(config, () -> 0.999999);
        BackoffCalculator random = new BackoffCalculator(config);

        // when & then
        assertThat(lowest.calculate(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(highest.calculate(3)).isLessThanOrEqualTo(Duration.ofSeconds(4))
            .isGreaterThan(Duration.ofMillis(3999));
        for (int i = 0; i < 100; i++) {
            assertThat(random.calculate(2)).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(2));
        }
    }

    @Test
    @DisplayName("initialDelay가 0이면 항상 0을 반환한다")
    void initialDelay_0() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(noJitter.withInitialDelay(Duration.ZERO).withJitter(true));

        // when & then
        assertThat(calculator.calculate(1)).isZero();
        assertThat(calculator.calculate(4)).isZero();
    }

    @Test
    void attempt가_양수가_아니면_예외() {
        BackoffCalculator calculator = new BackoffCalculator(noJitter);

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }
}
