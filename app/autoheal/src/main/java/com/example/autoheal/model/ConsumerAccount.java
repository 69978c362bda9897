/*
 * どこで: AutoHeal ドメインモデル
 * 何を: entitlement サービス上の consumer 情報を表現する
 * なぜ: サーバ側の autoheal フラグで healing 実行可否を判定するため
 */
package com.example.autoheal.model;

public record ConsumerAccount(String consumerId, String name, Boolean autoheal) {

  // autoheal が未設定の場合は無効として扱う
  public boolean autoHealEnabled() {
    return Boolean.TRUE.equals(autoheal);
  }
}
