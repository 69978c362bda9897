/*
 * どこで: AutoHeal ドメインモデル
 * 何を: healing サイクルの終端状態と人向けサマリ文言を定義する
 * なぜ: ログとメトリクスで「今日のみ有効/明日まで有効/今日分修復/明日分修復」を区別するため
 */
package com.example.autoheal.model;

import java.time.Instant;
import java.util.Locale;

public enum HealingOutcome {
  SKIPPED,
  VALID_TODAY,
  VALID_TODAY_AND_TOMORROW,
  HEALED_TODAY,
  HEALED_TOMORROW,
  FAILED;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String summary(Instant today, Instant tomorrow) {
    return switch (this) {
      case SKIPPED -> "entitlement auto healing was skipped because auto-heal is disabled";
      case VALID_TODAY ->
          "entitlement auto healing was checked and entitlements are valid today " + today;
      case VALID_TODAY_AND_TOMORROW ->
          "entitlement auto healing was checked and entitlements are valid today "
              + today
              + " and tomorrow "
              + tomorrow;
      case HEALED_TODAY -> "entitlements were healed for today " + today;
      case HEALED_TOMORROW -> "entitlements were healed for tomorrow " + tomorrow;
      case FAILED -> "entitlement auto healing failed";
    };
  }
}
