/*
 * どこで: AutoHeal API
 * 何を: healing レポートの応答形状を定義する
 * なぜ: 例外オブジェクトを含むドメインモデルをそのまま JSON 化しないため
 */
package com.example.autoheal.api;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealingReportResponse(
    List<GrantPayload> grants, List<ErrorPayload> errors, List<String> warnings) {

  public HealingReportResponse {
    grants = grants == null ? List.of() : List.copyOf(grants);
    errors = errors == null ? List.of() : List.copyOf(errors);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static HealingReportResponse from(HealingReport report) {
    return new HealingReportResponse(
        report.grants().stream().map(GrantPayload::from).toList(),
        report.errors().stream().map(ErrorPayload::from).toList(),
        report.warnings());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record GrantPayload(
      String grantId,
      String poolId,
      String stockKeepingUnit,
      int quantity,
      String startsAt,
      String endsAt) {

    static GrantPayload from(EntitlementGrant grant) {
      return new GrantPayload(
          grant.grantId(),
          grant.poolId(),
          grant.stockKeepingUnit(),
          grant.quantity(),
          format(grant.startsAt()),
          format(grant.endsAt()));
    }

    private static String format(Instant instant) {
      return instant == null ? null : instant.toString();
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ErrorPayload(String kind, String message) {

    static ErrorPayload from(HealingError error) {
      return new ErrorPayload(error.kind().name(), error.message());
    }
  }
}
