/*
 * どこで: AutoHeal サービス層
 * 何を: 設定値 autoheal.consumer-id から consumer を解決する
 * なぜ: 登録済みクライアントの識別子を起動時設定で与えるため
 */
package com.example.autoheal.service;

import com.example.autoheal.config.AutoHealProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredConsumerIdentity implements ConsumerIdentity {

  private final AutoHealProperties properties;

  @Override
  public String consumerId() {
    final String consumerId = properties.consumerId();
    if (consumerId == null || consumerId.isBlank()) {
      throw new IllegalStateException("autoheal.consumer-id is not configured");
    }
    return consumerId;
  }
}
