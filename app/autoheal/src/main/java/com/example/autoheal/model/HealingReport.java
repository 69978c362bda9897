/*
 * どこで: AutoHeal ドメインモデル
 * 何を: 1 回の healing サイクルで得た権利・エラー・警告を保持する
 * なぜ: サイクルごとに新規作成し、完了後は読み取り専用で呼び出し元へ返すため
 */
package com.example.autoheal.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one healing cycle.
 *
 * <p>An empty report means either that auto-heal is disabled for the consumer or that coverage
 * was checked and found valid; the two are deliberately not told apart here. Callers must inspect
 * {@link #errors()} before treating the absence of grants as healthy.
 */
public record HealingReport(
    List<EntitlementGrant> grants, List<HealingError> errors, List<String> warnings) {

  public HealingReport {
    grants = grants == null ? List.of() : List.copyOf(grants);
    errors = errors == null ? List.of() : List.copyOf(errors);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static HealingReport empty() {
    return new HealingReport(List.of(), List.of(), List.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return grants.isEmpty() && errors.isEmpty();
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Per-cycle accumulator. Not thread-safe; owned by the cycle that created it. */
  public static final class Builder {

    private final List<EntitlementGrant> grants = new ArrayList<>();
    private final List<HealingError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private Builder() {}

    public Builder addGrants(List<EntitlementGrant> received) {
      if (received != null) {
        grants.addAll(received);
      }
      return this;
    }

    public Builder addError(HealingError error) {
      errors.add(error);
      return this;
    }

    public Builder addWarning(String warning) {
      warnings.add(warning);
      return this;
    }

    public HealingReport build() {
      return new HealingReport(grants, errors, warnings);
    }
  }
}
