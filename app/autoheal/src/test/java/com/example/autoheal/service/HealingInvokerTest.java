/*
 * どこで: HealingInvoker のユニットテスト
 * 何を: 排他ロック下での実行、サイクルの直列化、メトリクスと直近レポートの記録を検証する
 * なぜ: healing と証明書リフレッシュが交錯しない契約を保証するため
 */
package com.example.autoheal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingErrorKind;
import com.example.autoheal.model.HealingOutcome;
import com.example.autoheal.model.HealingReport;
import com.example.autoheal.model.HealingResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HealingInvokerTest {

  private static final Instant NOW = Instant.parse("2024-01-10T00:00:00Z");
  private static final HealingReport HEALED_REPORT =
      HealingReport.builder()
          .addGrants(
              List.of(
                  new EntitlementGrant("grant-1", "pool-1", "sku-1", 1, NOW, null),
                  new EntitlementGrant("grant-2", "pool-2", "sku-2", 1, NOW, null)))
          .build();

  private HealingDecision decision;
  private EntitlementStateLock stateLock;
  private SimpleMeterRegistry registry;
  private HealingInvoker invoker;

  @BeforeEach
  void setUp() {
    decision = mock(HealingDecision.class);
    stateLock = new EntitlementStateLock();
    registry = new SimpleMeterRegistry();
    invoker =
        new HealingInvoker(
            decision, stateLock, new AutoHealMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void invokeUsesClockAndRecordsOutcome() {
    when(decision.perform(NOW))
        .thenReturn(new HealingResult(HealingOutcome.HEALED_TODAY, "healed", HEALED_REPORT));

    final HealingReport report = invoker.invoke();

    assertThat(report).isEqualTo(HEALED_REPORT);
    assertThat(invoker.lastReport()).contains(HEALED_REPORT);
    assertThat(
            registry.get("autoheal.cycle.total").tag("outcome", "healed_today").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("autoheal.bind.grants.total").counter().count()).isEqualTo(2.0d);
    assertThat(registry.get("autoheal.cycle.duration").timer().count()).isEqualTo(1L);
  }

  @Test
  void invokeReadsClockAfterAcquiringLock() {
    final Instant lockedAt = NOW.plusSeconds(600);
    final HealingInvoker lockAwareInvoker =
        new HealingInvoker(
            decision,
            stateLock,
            new AutoHealMetrics(registry),
            new LockAwareClock(stateLock, NOW, lockedAt));
    when(decision.perform(lockedAt))
        .thenReturn(new HealingResult(HealingOutcome.VALID_TODAY, "valid", HealingReport.empty()));

    lockAwareInvoker.invoke();

    verify(decision).perform(lockedAt);
  }

  @Test
  void invokeRecordsErrorKindsFromReport() {
    final HealingReport failed =
        HealingReport.builder()
            .addError(new HealingError(HealingErrorKind.SERVICE_ERROR, "server error", null))
            .build();
    when(decision.perform(NOW))
        .thenReturn(new HealingResult(HealingOutcome.FAILED, "failed", failed));

    final HealingReport report = invoker.invoke(NOW);

    assertThat(report.hasErrors()).isTrue();
    assertThat(
            registry
                .get("autoheal.cycle.error.total")
                .tag("kind", "service_error")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void returnsEmptyReportForSkippedCycle() {
    when(decision.perform(NOW))
        .thenReturn(new HealingResult(HealingOutcome.SKIPPED, "skipped", HealingReport.empty()));

    final HealingReport report = invoker.invoke(NOW);

    assertThat(report.isEmpty()).isTrue();
    assertThat(report.hasErrors()).isFalse();
  }

  @Test
  void lastReportIsEmptyBeforeFirstCycle() {
    assertThat(invoker.lastReport()).isEmpty();
  }

  @Test
  void holdsLockForWholeDecisionAndReleasesAfterwards() {
    final AtomicBoolean heldDuringDecision = new AtomicBoolean();
    when(decision.perform(NOW))
        .thenAnswer(
            invocation -> {
              heldDuringDecision.set(stateLock.isHeldByCurrentThread());
              return new HealingResult(
                  HealingOutcome.VALID_TODAY_AND_TOMORROW, "valid", HealingReport.empty());
            });

    invoker.invoke(NOW);

    assertThat(heldDuringDecision).isTrue();
    assertThat(stateLock.isLocked()).isFalse();
  }

  @Test
  void refreshTriggeredInsideCycleReentersLock() {
    final AtomicBoolean refreshed = new AtomicBoolean();
    when(decision.perform(NOW))
        .thenAnswer(
            invocation -> {
              stateLock.runExclusively(() -> refreshed.set(true));
              return new HealingResult(HealingOutcome.HEALED_TODAY, "healed", HEALED_REPORT);
            });

    invoker.invoke(NOW);

    assertThat(refreshed).isTrue();
    assertThat(stateLock.isLocked()).isFalse();
  }

  @Test
  void overlappingInvocationsAreSerialized() throws Exception {
    final CountDownLatch firstEntered = new CountDownLatch(1);
    final CountDownLatch releaseFirst = new CountDownLatch(1);
    final AtomicInteger active = new AtomicInteger();
    final AtomicInteger maxActive = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();
    when(decision.perform(any()))
        .thenAnswer(
            invocation -> {
              maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
              if (calls.incrementAndGet() == 1) {
                firstEntered.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
              }
              active.decrementAndGet();
              return new HealingResult(
                  HealingOutcome.VALID_TODAY_AND_TOMORROW, "valid", HealingReport.empty());
            });
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<HealingReport> first = executor.submit(() -> invoker.invoke(NOW));
      assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();
      final Future<HealingReport> second = executor.submit(() -> invoker.invoke(NOW));
      // 2 件目はロック待ちで判定処理に入れない
      Thread.sleep(200);
      assertThat(calls.get()).isEqualTo(1);

      releaseFirst.countDown();
      first.get(5, TimeUnit.SECONDS);
      second.get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertThat(calls.get()).isEqualTo(2);
    assertThat(maxActive.get()).isEqualTo(1);
    verify(decision, times(2)).perform(NOW);
  }

  // ロック取得前後で異なる時刻を返し、判定時刻がロック取得後に読まれることを確かめる
  private static final class LockAwareClock extends Clock {

    private final EntitlementStateLock lock;
    private final Instant unlocked;
    private final Instant locked;

    LockAwareClock(EntitlementStateLock lock, Instant unlocked, Instant locked) {
      this.lock = lock;
      this.unlocked = unlocked;
      this.locked = locked;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return lock.isHeldByCurrentThread() ? locked : unlocked;
    }
  }
}
