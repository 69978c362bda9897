/*
 * どこで: AutoHeal サービス層
 * 何を: 名前付き拡張ポイントの実行を抽象化する
 * なぜ: 判定ロジックが hook の登録方式に依存しないようにするため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HookContext;
import com.example.autoheal.model.HookPoint;

public interface HookDispatcher {

  /** Runs every hook registered for {@code point}; throws {@link HookExecutionException}. */
  void run(HookPoint point, HookContext context);
}
