/*
 * どこで: AutoHeal ドメインモデル
 * 何を: hook に渡す consumer と付与済み権利を表現する
 * なぜ: pre では consumer のみ、post では bind 結果も渡すため
 */
package com.example.autoheal.model;

import java.util.List;

public record HookContext(String consumerId, List<EntitlementGrant> grants) {

  public HookContext {
    grants = grants == null ? List.of() : List.copyOf(grants);
  }

  public static HookContext beforeAttach(String consumerId) {
    return new HookContext(consumerId, List.of());
  }

  public static HookContext afterAttach(String consumerId, List<EntitlementGrant> grants) {
    return new HookContext(consumerId, grants);
  }
}
