/*
 * どこで: AutoHeal ドメインモデル
 * 何を: bind で付与された 1 件の権利を表現する
 * なぜ: レポートと hook に下流 DTO を漏らさず型安全に渡すため
 */
package com.example.autoheal.model;

import java.time.Instant;

public record EntitlementGrant(
    String grantId,
    String poolId,
    String stockKeepingUnit,
    int quantity,
    Instant startsAt,
    Instant endsAt) {}
