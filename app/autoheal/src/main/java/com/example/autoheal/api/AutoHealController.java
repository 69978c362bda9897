/*
 * どこで: AutoHeal API
 * 何を: healing サイクルの手動実行と直近結果の参照を提供する
 * なぜ: スケジュールを待たずに修復を試し、結果を運用から確認できるようにするため
 */
package com.example.autoheal.api;

import com.example.autoheal.model.HealingReport;
import com.example.autoheal.service.CertificateRefresher;
import com.example.autoheal.service.HealingInvoker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/autoheal")
@RequiredArgsConstructor
public class AutoHealController {

  private final HealingInvoker healingInvoker;
  private final CertificateRefresher certificateRefresher;

  @PostMapping("/cycles")
  public HealingReportResponse runCycle() {
    final HealingReport report = healingInvoker.invoke();
    certificateRefresher.refresh();
    return HealingReportResponse.from(report);
  }

  @GetMapping("/cycles/last")
  public HealingReportResponse lastCycle() {
    return healingInvoker
        .lastReport()
        .map(HealingReportResponse::from)
        .orElseThrow(() -> new NoCompletedCycleException("no healing cycle has completed yet"));
  }
}
