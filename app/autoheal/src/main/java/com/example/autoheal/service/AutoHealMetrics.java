/*
 * どこで: AutoHeal サービス層
 * 何を: healing サイクルの結果/エラー/所要時間をメトリクスとして記録する
 * なぜ: 修復が発生した頻度と失敗が続いていないかを運用で監視できるようにするため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HealingErrorKind;
import com.example.autoheal.model.HealingOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AutoHealMetrics {

  private static final String METRIC_CYCLE_TOTAL = "autoheal.cycle.total";
  private static final String METRIC_CYCLE_ERROR_TOTAL = "autoheal.cycle.error.total";
  private static final String METRIC_CYCLE_DURATION = "autoheal.cycle.duration";
  private static final String METRIC_BIND_GRANTS_TOTAL = "autoheal.bind.grants.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<HealingOutcome, Counter> cycleCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<HealingErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();
  private final Timer cycleDurationTimer;
  private final Counter boundGrantsCounter;

  public AutoHealMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.cycleDurationTimer =
        Timer.builder(METRIC_CYCLE_DURATION)
            .description("Healing cycle duration including lock wait")
            .register(meterRegistry);
    this.boundGrantsCounter =
        Counter.builder(METRIC_BIND_GRANTS_TOTAL)
            .description("Entitlement grants received from auto-attach binds")
            .register(meterRegistry);
  }

  public void recordCycle(HealingOutcome outcome, Duration duration) {
    cycleCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_CYCLE_TOTAL)
                    .description("Healing cycle outcomes")
                    .tags(Tags.of("outcome", outcome.tagValue()))
                    .register(meterRegistry))
        .increment();
    if (duration != null && !duration.isNegative()) {
      cycleDurationTimer.record(duration);
    }
  }

  public void recordError(HealingErrorKind kind) {
    errorCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_CYCLE_ERROR_TOTAL)
                    .description("Healing cycle errors by kind")
                    .tags(Tags.of("kind", kind.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordBoundGrants(int count) {
    if (count > 0) {
      boundGrantsCounter.increment(count);
    }
  }
}
