/*
 * どこで: AutoHeal 拡張ポイント
 * 何を: auto-attach 前後の事実を監査ログとして残す標準 hook
 * なぜ: どの consumer にいつ何件の権利が付与されたかを後から追えるようにするため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HookContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(
    name = "autoheal.audit-hook-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LoggingAutoAttachHook implements AutoAttachHook {

  private static final Logger logger = LoggerFactory.getLogger(LoggingAutoAttachHook.class);

  @Override
  public void preAutoAttach(HookContext context) {
    logger.info("auto-attach starting consumerId={}", context.consumerId());
  }

  @Override
  public void postAutoAttach(HookContext context) {
    logger.info(
        "auto-attach finished consumerId={} grantCount={} skus={}",
        context.consumerId(),
        context.grants().size(),
        context.grants().stream().map(EntitlementGrant::stockKeepingUnit).toList());
  }
}
