/*
 * どこで: AutoHeal ワーカー
 * 何を: healing サイクルと証明書リフレッシュをスケジュールで順に起動する
 * なぜ: サーバ側の権利更新が終わってからローカル状態を突き合わせる順序を守るため
 */
package com.example.autoheal.worker;

import com.example.autoheal.config.AutoHealProperties;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingReport;
import com.example.autoheal.service.CertificateRefresher;
import com.example.autoheal.service.HealingInvoker;
import com.example.common.TraceIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "autoheal.enabled", havingValue = "true", matchIfMissing = true)
public class AutoHealWorker {

  private static final Logger logger = LoggerFactory.getLogger(AutoHealWorker.class);

  private final HealingInvoker healingInvoker;
  private final CertificateRefresher certificateRefresher;
  private final AutoHealProperties properties;

  @Scheduled(
      fixedDelayString = "${autoheal.interval:PT4H}",
      initialDelayString = "${autoheal.initial-delay:PT1M}")
  public void run() {
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      final HealingReport report = healingInvoker.invoke();
      for (HealingError error : report.errors()) {
        logger.warn(
            "healing cycle reported error kind={} message={}", error.kind(), error.message());
      }
      // invoke() がロックを解放して戻った後にだけ refresh を走らせる
      if (properties.refreshAfterCycle()) {
        certificateRefresher.refresh();
      }
    } catch (RuntimeException ex) {
      logger.warn("auto-heal worker run failed", ex);
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
    }
  }
}
