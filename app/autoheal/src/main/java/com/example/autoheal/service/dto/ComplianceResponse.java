/*
 * どこで: AutoHeal 下流 DTO
 * 何を: compliance 取得 API の応答を表現する
 * なぜ: 有効/無効と compliant_until を判定に渡すため
 */
package com.example.autoheal.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComplianceResponse(Boolean compliant, String status, String compliantUntil) {}
