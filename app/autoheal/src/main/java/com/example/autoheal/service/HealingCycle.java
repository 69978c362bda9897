/*
 * どこで: AutoHeal サービス層
 * 何を: 1 回の healing サイクル内の状態遷移とレポート蓄積を保持する
 * なぜ: シングルトンの判定処理にサイクル固有の可変状態を持たせないため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingOutcome;
import com.example.autoheal.model.HealingPhase;
import com.example.autoheal.model.HealingReport;
import com.example.autoheal.model.HealingResult;
import java.time.Instant;
import java.util.List;

final class HealingCycle {

  private final Instant today;
  private final Instant tomorrow;
  private final HealingReport.Builder report = HealingReport.builder();
  private HealingPhase phase = HealingPhase.IDLE;

  HealingCycle(Instant today, Instant tomorrow) {
    this.today = today;
    this.tomorrow = tomorrow;
  }

  Instant today() {
    return today;
  }

  Instant tomorrow() {
    return tomorrow;
  }

  HealingPhase phase() {
    return phase;
  }

  void transitionTo(HealingPhase next) {
    if (!phase.canTransitionTo(next)) {
      throw new IllegalStateException("illegal healing transition " + phase + " -> " + next);
    }
    phase = next;
  }

  void recordGrants(List<EntitlementGrant> grants) {
    report.addGrants(grants);
  }

  void recordWarning(String warning) {
    report.addWarning(warning);
  }

  HealingResult finish(HealingOutcome outcome) {
    transitionTo(HealingPhase.DONE);
    return new HealingResult(outcome, outcome.summary(today, tomorrow), report.build());
  }

  HealingResult fail(HealingError error) {
    report.addError(error);
    if (!phase.isTerminal()) {
      phase = HealingPhase.DONE;
    }
    return new HealingResult(
        HealingOutcome.FAILED,
        HealingOutcome.FAILED.summary(today, tomorrow) + ": " + error.message(),
        report.build());
  }
}
