/*
 * どこで: AutoHeal サービス層
 * 何を: hook 実行中の失敗を表現する
 * なぜ: healing サイクルで HOOK_ERROR として区別して記録するため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HookPoint;

public class HookExecutionException extends RuntimeException {

  private final HookPoint point;
  private final String hookName;

  public HookExecutionException(HookPoint point, String hookName, Throwable cause) {
    super("hook " + hookName + " failed at " + point.hookName(), cause);
    this.point = point;
    this.hookName = hookName;
  }

  public HookPoint point() {
    return point;
  }

  public String hookName() {
    return hookName;
  }
}
