/*
 * どこで: AutoHeal サービス層
 * 何を: entitlement 下流呼び出し失敗を表現する
 * なぜ: healing サイクルで SERVICE_ERROR として一貫して記録するため
 */
package com.example.autoheal.service;

public class EntitlementServiceException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public EntitlementServiceException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EntitlementServiceException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
