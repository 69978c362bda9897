/*
 * どこで: AutoHeal 下流 DTO
 * 何を: bind/一覧 API が返す権利 1 件を表現する
 * なぜ: 日付文字列の解釈をクライアント側に閉じ込めるため
 */
package com.example.autoheal.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GrantResponse(
    String id,
    String poolId,
    String stockKeepingUnit,
    Integer quantity,
    String startDate,
    String endDate) {}
