/*
 * どこで: AutoHeal ドメインモデル
 * 何を: healing サイクル中に捕捉したエラーを構造化して保持する
 * なぜ: 例外を再送出せず、レポート経由で呼び出し元へ返すため
 */
package com.example.autoheal.model;

public record HealingError(HealingErrorKind kind, String message, Throwable cause) {

  public HealingError {
    message = message == null || message.isBlank() ? kind.name() : message;
  }
}
