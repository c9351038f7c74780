/**
 * Provider 계약 테스트 기반 클래스.
 *
 * <p>새 Provider 구현체는 {@link com.ryuqq.relay.testkit.contract.AbstractProviderContractTest}를
 * 상속해 공통 계약을 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.contract;
