/*
 * どこで: AutoHeal サービス層
 * 何を: スケジューラから呼ばれる healing サイクルの入口
 * なぜ: サイクル全体を排他ロック下で直列化し、証明書リフレッシュとの順序を保証するため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingReport;
import com.example.autoheal.model.HealingResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one healing cycle while holding {@link EntitlementStateLock}.
 *
 * <p>Ordering contract: this call updates entitlement state on the server but leaves the
 * top-level {@link CertificateRefresher#refresh()} to the caller, which must run it only after
 * {@link #invoke()} has returned.
 */
@Service
@RequiredArgsConstructor
public class HealingInvoker {

  private static final Logger logger = LoggerFactory.getLogger(HealingInvoker.class);

  private final HealingDecision healingDecision;
  private final EntitlementStateLock stateLock;
  private final AutoHealMetrics metrics;
  private final Clock clock;
  private final AtomicReference<HealingReport> lastReport = new AtomicReference<>();

  /** Runs a cycle as of the time the lock is acquired. */
  public HealingReport invoke() {
    return run(() -> Instant.now(clock));
  }

  public HealingReport invoke(Instant now) {
    return run(() -> now);
  }

  private HealingReport run(Supplier<Instant> now) {
    final Instant startedAt = Instant.now(clock);
    final HealingResult result =
        stateLock.callExclusively(() -> healingDecision.perform(now.get()));
    final HealingReport report = result.report();
    metrics.recordCycle(result.outcome(), Duration.between(startedAt, Instant.now(clock)));
    metrics.recordBoundGrants(report.grants().size());
    for (HealingError error : report.errors()) {
      metrics.recordError(error.kind());
    }
    lastReport.set(report);
    logger.info(
        "healing cycle finished outcome={} grants={} errors={} warnings={} summary={}",
        result.outcome().tagValue(),
        report.grants().size(),
        report.errors().size(),
        report.warnings().size(),
        result.summary());
    return report;
  }

  public Optional<HealingReport> lastReport() {
    return Optional.ofNullable(lastReport.get());
  }
}
