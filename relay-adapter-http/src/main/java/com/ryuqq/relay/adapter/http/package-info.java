/**
 * {@code java.net.http.HttpClient}와 Jackson으로 구현한 OpenAI 호환 NetworkProvider 어댑터.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.http.HttpNetworkProviderBuilder} - ProviderFactory에 주입하는 빌더</li>
 *   <li>{@link com.ryuqq.relay.adapter.http.OpenAiProvider}, {@link com.ryuqq.relay.adapter.http.OpenRouterProvider},
 *       {@link com.ryuqq.relay.adapter.http.LmStudioProvider} - 백엔드별 Provider</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.http;
