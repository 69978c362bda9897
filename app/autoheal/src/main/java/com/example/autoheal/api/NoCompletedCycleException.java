/*
 * どこで: AutoHeal API
 * 何を: まだ healing サイクルが 1 度も完了していないことを表す例外
 * なぜ: 直近レポート参照で 404 を返すため
 */
package com.example.autoheal.api;

public class NoCompletedCycleException extends RuntimeException {

  public NoCompletedCycleException(String message) {
    super(message);
  }
}
