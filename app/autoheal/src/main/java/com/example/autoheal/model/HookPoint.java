/*
 * どこで: AutoHeal ドメインモデル
 * 何を: auto-attach 前後の拡張ポイント名を定義する
 * なぜ: hook 名を文字列で散在させず、固定の 2 箇所に限定するため
 */
package com.example.autoheal.model;

public enum HookPoint {
  PRE_AUTO_ATTACH("pre_auto_attach"),
  POST_AUTO_ATTACH("post_auto_attach");

  private final String hookName;

  HookPoint(String hookName) {
    this.hookName = hookName;
  }

  public String hookName() {
    return hookName;
  }
}
