/*
 * どこで: AutoHeal サービス層
 * 何を: entitlement サービスへの呼び出しを抽象化する
 * なぜ: healing 判定をネットワークから切り離し、テストで差し替えられるようにするため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.ConsumerAccount;
import com.example.autoheal.model.CoverageWindow;
import com.example.autoheal.model.EntitlementGrant;
import java.time.Instant;
import java.util.List;

/**
 * Remote entitlement service. Every operation may block on network I/O and reports failures as
 * {@link EntitlementServiceException}.
 */
public interface EntitlementClient {

  ConsumerAccount getAccount(String consumerId);

  /** Compliance of the consumer's current coverage evaluated as of {@code onDate}. */
  CoverageWindow getCompliance(String consumerId, Instant onDate);

  /** Asks the server to attach grants that make the consumer compliant as of {@code entitleDate}. */
  List<EntitlementGrant> bind(String consumerId, Instant entitleDate);

  List<EntitlementGrant> listGrants(String consumerId);
}
