/*
 * どこで: AutoHeal サービス層
 * 何を: サーバ側の権利状態とローカルの資格情報を突き合わせる
 * なぜ: bind 後に付与された権利をクライアントへ反映するため
 */
package com.example.autoheal.service;

/**
 * Reconciles local credential state with the server's entitlement state.
 *
 * <p>Top-level callers must invoke {@link #refresh()} only after {@link HealingInvoker#invoke()}
 * has returned, so that entitlement changes have landed on the server first. Implementations take
 * {@link EntitlementStateLock} and therefore never run concurrently with a healing cycle.
 */
public interface CertificateRefresher {

  void refresh();
}
