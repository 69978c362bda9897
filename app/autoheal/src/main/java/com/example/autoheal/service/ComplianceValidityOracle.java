/*
 * どこで: AutoHeal サービス層
 * 何を: entitlement サービスの compliance 評価を ValidityOracle として提供する
 * なぜ: サーバ側で計算した有効期限(compliant_until)を判定に使うため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.CoverageWindow;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ComplianceValidityOracle implements ValidityOracle {

  private static final Logger logger = LoggerFactory.getLogger(ComplianceValidityOracle.class);

  private final EntitlementClient entitlementClient;

  @Override
  public CoverageWindow evaluate(String consumerId, Instant now) {
    final CoverageWindow window = entitlementClient.getCompliance(consumerId, now);
    logger.debug(
        "compliance evaluated consumerId={} onDate={} valid={} compliantUntil={}",
        consumerId,
        now,
        window.valid(),
        window.compliantUntil());
    return window;
  }
}
