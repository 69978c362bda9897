/*
 * どこで: AutoHeal サービス層
 * 何を: healing サイクルと証明書リフレッシュで共有する再入可能ロック
 * なぜ: サーバ側の権利更新とローカル状態の突き合わせを並行させないため
 */
package com.example.autoheal.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Process-wide mutual exclusion between {@link HealingInvoker} and {@link CertificateRefresher}.
 *
 * <p>A healing cycle holds the lock end-to-end, so two cycles never overlap and no refresh runs
 * while entitlement state is being changed on the server. The lock is reentrant because the cycle
 * itself triggers a refresh after a successful bind.
 */
@Component
public class EntitlementStateLock {

  private final ReentrantLock lock = new ReentrantLock();

  public <T> T callExclusively(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void runExclusively(Runnable action) {
    callExclusively(
        () -> {
          action.run();
          return null;
        });
  }

  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  public boolean isLocked() {
    return lock.isLocked();
  }
}
