/*
 * どこで: AutoHeal ドメインモデル
 * 何を: healing サイクルで記録するエラー種別を定義する
 * なぜ: 呼び出し元とメトリクスで失敗原因を区別できるようにするため
 */
package com.example.autoheal.model;

public enum HealingErrorKind {
  SERVICE_ERROR,
  HOOK_ERROR,
  UNEXPECTED
}
