/*
 * どこで: AutoHeal 設定
 * 何を: entitlement サービス呼び出し設定を保持する
 * なぜ: 下流 URL とパス、認証ヘッダを外部化するため
 */
package com.example.autoheal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "entitlement-service")
public record EntitlementServiceProperties(
    String baseUrl,
    String consumerPath,
    String compliancePath,
    String entitlementsPath,
    String authHeaderName,
    String authToken) {

  public EntitlementServiceProperties {
    baseUrl = isBlank(baseUrl) ? "http://entitlement:80" : baseUrl;
    consumerPath = isBlank(consumerPath) ? "/consumers/{consumerId}" : consumerPath;
    compliancePath =
        isBlank(compliancePath) ? "/consumers/{consumerId}/compliance" : compliancePath;
    entitlementsPath =
        isBlank(entitlementsPath) ? "/consumers/{consumerId}/entitlements" : entitlementsPath;
    authHeaderName = isBlank(authHeaderName) ? "Authorization" : authHeaderName;
  }

  public boolean hasAuthToken() {
    return !isBlank(authToken);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
