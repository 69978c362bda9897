/*
 * どこで: AutoHeal ドメインモデル
 * 何を: ある時点での権利カバレッジ(有効か/いつまで有効か)を表現する
 * なぜ: 1 サイクル内では同じ評価結果を使い回し、再取得しないため
 */
package com.example.autoheal.model;

import java.time.Instant;
import java.util.Optional;

public record CoverageWindow(boolean valid, Instant compliantUntil) {

  public static CoverageWindow invalid() {
    return new CoverageWindow(false, null);
  }

  public static CoverageWindow validUntil(Instant compliantUntil) {
    return new CoverageWindow(true, compliantUntil);
  }

  public Optional<Instant> expiryInstant() {
    return Optional.ofNullable(compliantUntil);
  }

  /** Returns true when coverage is valid now and has not lapsed by {@code instant}. */
  public boolean coversThrough(Instant instant) {
    return valid && compliantUntil != null && !instant.isAfter(compliantUntil);
  }
}
