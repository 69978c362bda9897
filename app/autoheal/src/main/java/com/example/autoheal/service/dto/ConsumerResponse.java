/*
 * どこで: AutoHeal 下流 DTO
 * 何を: consumer 取得 API の応答を表現する
 * なぜ: autoheal フラグを型安全に読み取るため
 */
package com.example.autoheal.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsumerResponse(String uuid, String name, Boolean autoheal) {}
