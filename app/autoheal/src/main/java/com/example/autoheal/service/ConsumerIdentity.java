/*
 * どこで: AutoHeal サービス層
 * 何を: healing 対象の consumer を解決する
 * なぜ: 識別子の取得元(設定/登録情報)を判定ロジックから切り離すため
 */
package com.example.autoheal.service;

public interface ConsumerIdentity {

  /** Returns the registered consumer id; throws {@link IllegalStateException} if unregistered. */
  String consumerId();
}
