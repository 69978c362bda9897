/*
 * どこで: AutoHeal サービス層
 * 何を: 現在の権利カバレッジの有効性を評価する
 * なぜ: 判定ロジックを評価方式(ローカル証明書/サーバ compliance)から切り離すため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.CoverageWindow;
import java.time.Instant;

public interface ValidityOracle {

  /**
   * Evaluates coverage once for the cycle. The returned window is the cached state the cycle
   * keeps using; it is not re-fetched for the tomorrow check.
   */
  CoverageWindow evaluate(String consumerId, Instant now);
}
