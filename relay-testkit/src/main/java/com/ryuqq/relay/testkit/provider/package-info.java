/**
 * Provider 테스트 더블.
 *
 * <p>{@link com.ryuqq.relay.testkit.provider.ScriptedProvider}는 실제 재시도 경로를 타는
 * NetworkProvider이고, {@link com.ryuqq.relay.testkit.provider.ManualClock}과
 * {@link com.ryuqq.relay.testkit.provider.RecordingRetryWaiter}는 시간과 대기를 테스트가 통제하게 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.provider;
