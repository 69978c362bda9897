/*
 * どこで: AutoHeal ドメインモデル
 * 何を: ローカルに保持している現在の権利一覧を表現する
 * なぜ: サーバ側の権利状態と突き合わせた結果を参照できるようにするため
 */
package com.example.autoheal.model;

import java.time.Instant;
import java.util.List;

public record GrantSnapshot(List<EntitlementGrant> grants, Instant refreshedAt) {

  public GrantSnapshot {
    grants = grants == null ? List.of() : List.copyOf(grants);
  }
}
