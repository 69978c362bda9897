/*
 * どこで: AutoHeal ドメインモデル
 * 何を: 1 サイクル内の healing 状態遷移を定義する
 * なぜ: 今日/明日の分岐が排他であることを遷移規則として固定するため
 */
package com.example.autoheal.model;

public enum HealingPhase {
  IDLE,
  CHECKING_TODAY,
  REMEDIATING_TODAY,
  CHECKING_TOMORROW,
  REMEDIATING_TOMORROW,
  SATISFIED,
  DONE;

  public boolean canTransitionTo(HealingPhase next) {
    // DONE へはどの途中状態からも遷移できる(スキップ/失敗時の打ち切り)
    if (next == DONE) {
      return this != DONE;
    }
    return switch (this) {
      case IDLE -> next == CHECKING_TODAY;
      case CHECKING_TODAY -> next == REMEDIATING_TODAY || next == CHECKING_TOMORROW;
      case CHECKING_TOMORROW -> next == REMEDIATING_TOMORROW || next == SATISFIED;
      case REMEDIATING_TODAY, REMEDIATING_TOMORROW, SATISFIED, DONE -> false;
    };
  }

  public boolean isTerminal() {
    return this == DONE;
  }
}
