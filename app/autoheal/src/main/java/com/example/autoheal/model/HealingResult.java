/*
 * どこで: AutoHeal ドメインモデル
 * 何を: 判定処理の終端状態とレポートを組で返す
 * なぜ: 例外ではなく戻り値で成功/失敗を伝えるため
 */
package com.example.autoheal.model;

public record HealingResult(HealingOutcome outcome, String summary, HealingReport report) {}
