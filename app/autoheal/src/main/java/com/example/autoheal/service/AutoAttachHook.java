/*
 * どこで: AutoHeal 拡張ポイント
 * 何を: auto-attach 前後に呼ばれる hook を定義する
 * なぜ: bind の前後に呼び出し側固有の副作用を差し込めるようにするため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HookContext;

/**
 * Extension invoked around a remediation request. Register an implementation as a Spring bean;
 * {@code @Order} controls the dispatch order. Exceptions abort the healing cycle and are reported
 * as hook errors.
 */
public interface AutoAttachHook {

  default void preAutoAttach(HookContext context) {}

  default void postAutoAttach(HookContext context) {}

  default String name() {
    return getClass().getSimpleName();
  }
}
