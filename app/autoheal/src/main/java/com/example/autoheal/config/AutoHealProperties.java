/*
 * どこで: AutoHeal アプリの設定バインド
 * 何を: healing スケジュールと判定パラメータを保持する
 * なぜ: 実行間隔や「明日」の判定幅を運用で調整できるようにするため
 */
package com.example.autoheal.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "autoheal")
public record AutoHealProperties(
    boolean enabled,
    Duration interval,
    Duration horizon,
    String consumerId,
    Boolean refreshAfterCycle) {

  public AutoHealProperties {
    interval = interval == null ? Duration.ofHours(4) : interval;
    horizon = horizon == null ? Duration.ofHours(24) : horizon;
    refreshAfterCycle = refreshAfterCycle == null ? Boolean.TRUE : refreshAfterCycle;
    if (horizon.isNegative() || horizon.isZero()) {
      throw new IllegalArgumentException("autoheal.horizon must be positive");
    }
  }
}
