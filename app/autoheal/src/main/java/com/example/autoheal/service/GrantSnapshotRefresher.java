/*
 * どこで: AutoHeal サービス層
 * 何を: サーバ上の現在の権利一覧を取得し、ローカルのスナップショットを置き換える
 * なぜ: healing で付与された権利をローカル状態へ反映するため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.GrantSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GrantSnapshotRefresher implements CertificateRefresher {

  private static final Logger logger = LoggerFactory.getLogger(GrantSnapshotRefresher.class);

  private final EntitlementClient entitlementClient;
  private final ConsumerIdentity consumerIdentity;
  private final EntitlementStateLock stateLock;
  private final Clock clock;
  private final AtomicReference<GrantSnapshot> snapshot = new AtomicReference<>();

  @Override
  public void refresh() {
    stateLock.runExclusively(this::reconcile);
  }

  public Optional<GrantSnapshot> currentSnapshot() {
    return Optional.ofNullable(snapshot.get());
  }

  private void reconcile() {
    final String consumerId = consumerIdentity.consumerId();
    final List<EntitlementGrant> serverGrants;
    try {
      serverGrants = entitlementClient.listGrants(consumerId);
    } catch (EntitlementServiceException ex) {
      // 前回のスナップショットを保持し、次回の refresh で再取得する
      logger.warn(
          "grant refresh failed consumerId={} reason={}", consumerId, ex.reason(), ex);
      return;
    }
    final GrantSnapshot previous = snapshot.get();
    final Set<String> previousIds = grantIds(previous == null ? List.of() : previous.grants());
    final Set<String> currentIds = grantIds(serverGrants);
    final long added = currentIds.stream().filter(id -> !previousIds.contains(id)).count();
    final long removed = previousIds.stream().filter(id -> !currentIds.contains(id)).count();
    snapshot.set(new GrantSnapshot(serverGrants, Instant.now(clock)));
    logger.info(
        "grant refresh completed consumerId={} total={} added={} removed={}",
        consumerId,
        serverGrants.size(),
        added,
        removed);
  }

  private Set<String> grantIds(List<EntitlementGrant> grants) {
    return grants.stream().map(EntitlementGrant::grantId).collect(Collectors.toSet());
  }
}
