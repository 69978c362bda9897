/*
 * どこで: AutoHeal 設定
 * 何を: entitlement サービス呼び出し専用 RestClient を提供する
 * なぜ: baseUrl と認証ヘッダの設定責務をクライアント実装から分離するため
 */
package com.example.autoheal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class EntitlementServiceClientConfig {

  @Bean
  RestClient entitlementRestClient(
      RestClient.Builder builder, EntitlementServiceProperties properties) {
    final RestClient.Builder configured = builder.baseUrl(properties.baseUrl());
    if (properties.hasAuthToken()) {
      configured.defaultHeader(properties.authHeaderName(), properties.authToken());
    }
    return configured.build();
  }
}
