/*
 * どこで: AutoHeal サービス層
 * 何を: 今日と 24 時間後の 2 時点で権利の有効性を確認し、必要なら auto-attach を 1 回だけ行う
 * なぜ: 権利が失効してから気付くのではなく、失効前に隙間を埋めるため
 */
package com.example.autoheal.service;

import com.example.autoheal.config.AutoHealProperties;
import com.example.autoheal.model.ConsumerAccount;
import com.example.autoheal.model.CoverageWindow;
import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingErrorKind;
import com.example.autoheal.model.HealingOutcome;
import com.example.autoheal.model.HealingPhase;
import com.example.autoheal.model.HealingResult;
import com.example.autoheal.model.HookContext;
import com.example.autoheal.model.HookPoint;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Two-horizon healing check.
 *
 * <p>If coverage is invalid now, binds as of now and stops; the tomorrow check is left to the
 * next cycle. If coverage is valid now but lapses before {@code now + horizon}, binds as of that
 * instant. At most one bind is issued per call. Failures never propagate: they end the cycle and
 * are returned in the report.
 */
@Service
@RequiredArgsConstructor
public class HealingDecision {

  private static final Logger logger = LoggerFactory.getLogger(HealingDecision.class);

  static final String WARNING_MISSING_COMPLIANT_UNTIL =
      "got valid status from server but no compliant-until date";

  private final EntitlementClient entitlementClient;
  private final ValidityOracle validityOracle;
  private final HookDispatcher hookDispatcher;
  private final CertificateRefresher certificateRefresher;
  private final ConsumerIdentity consumerIdentity;
  private final AutoHealProperties properties;

  public HealingResult perform(Instant now) {
    final HealingCycle cycle = new HealingCycle(now, now.plus(properties.horizon()));
    String consumerId = null;
    try {
      consumerId = consumerIdentity.consumerId();
      final ConsumerAccount account = entitlementClient.getAccount(consumerId);
      if (!account.autoHealEnabled()) {
        logger.warn("auto-heal disabled on server, skipping consumerId={}", consumerId);
        return cycle.finish(HealingOutcome.SKIPPED);
      }

      cycle.transitionTo(HealingPhase.CHECKING_TODAY);
      final CoverageWindow window = validityOracle.evaluate(consumerId, now);
      if (!window.valid()) {
        logger.warn("found invalid entitlements for today consumerId={} today={}", consumerId, now);
        cycle.transitionTo(HealingPhase.REMEDIATING_TODAY);
        autoAttach(cycle, consumerId, cycle.today());
        return complete(cycle, consumerId, HealingOutcome.HEALED_TODAY);
      }

      cycle.transitionTo(HealingPhase.CHECKING_TOMORROW);
      final Optional<Instant> compliantUntil = window.expiryInstant();
      if (compliantUntil.isEmpty()) {
        logger.warn("{} consumerId={}", WARNING_MISSING_COMPLIANT_UNTIL, consumerId);
        cycle.recordWarning(WARNING_MISSING_COMPLIANT_UNTIL);
        cycle.transitionTo(HealingPhase.SATISFIED);
        return complete(cycle, consumerId, HealingOutcome.VALID_TODAY);
      }
      if (!window.coversThrough(cycle.tomorrow())) {
        logger.warn(
            "entitlements will be invalid by tomorrow consumerId={} tomorrow={} compliantUntil={}",
            consumerId,
            cycle.tomorrow(),
            compliantUntil.get());
        cycle.transitionTo(HealingPhase.REMEDIATING_TOMORROW);
        autoAttach(cycle, consumerId, cycle.tomorrow());
        return complete(cycle, consumerId, HealingOutcome.HEALED_TOMORROW);
      }
      cycle.transitionTo(HealingPhase.SATISFIED);
      return complete(cycle, consumerId, HealingOutcome.VALID_TODAY_AND_TOMORROW);
    } catch (RuntimeException ex) {
      logger.error(
          "error attempting to auto-heal consumerId={} phase={}", consumerId, cycle.phase(), ex);
      return cycle.fail(toHealingError(ex));
    }
  }

  private void autoAttach(HealingCycle cycle, String consumerId, Instant entitleDate) {
    hookDispatcher.run(HookPoint.PRE_AUTO_ATTACH, HookContext.beforeAttach(consumerId));
    final List<EntitlementGrant> grants = entitlementClient.bind(consumerId, entitleDate);
    // bind はサーバ側で確定済みのため、後続 hook が失敗しても付与結果は残す
    cycle.recordGrants(grants);
    try {
      hookDispatcher.run(
          HookPoint.POST_AUTO_ATTACH, HookContext.afterAttach(consumerId, grants));
    } finally {
      // bind 後の refresh は post hook の成否に関わらず必ず行う
      certificateRefresher.refresh();
    }
  }

  private HealingResult complete(HealingCycle cycle, String consumerId, HealingOutcome outcome) {
    final HealingResult result = cycle.finish(outcome);
    logger.debug("auto-heal check complete consumerId={} summary={}", consumerId, result.summary());
    return result;
  }

  private HealingError toHealingError(RuntimeException ex) {
    if (ex instanceof EntitlementServiceException) {
      return new HealingError(HealingErrorKind.SERVICE_ERROR, ex.getMessage(), ex);
    }
    if (ex instanceof HookExecutionException) {
      return new HealingError(HealingErrorKind.HOOK_ERROR, ex.getMessage(), ex);
    }
    return new HealingError(HealingErrorKind.UNEXPECTED, ex.getMessage(), ex);
  }
}
