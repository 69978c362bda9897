/*
 * どこで: AutoHeal サービス層
 * 何を: Spring Bean として登録された AutoAttachHook を順に実行する
 * なぜ: プラグイン読み込み機構を持たずに拡張ポイントを提供するため
 */
package com.example.autoheal.service;

import com.example.autoheal.model.HookContext;
import com.example.autoheal.model.HookPoint;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class BeanHookDispatcher implements HookDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(BeanHookDispatcher.class);

  private final List<AutoAttachHook> hooks;

  @Autowired
  public BeanHookDispatcher(ObjectProvider<AutoAttachHook> hookProvider) {
    this(hookProvider.orderedStream().toList());
  }

  @VisibleForTesting
  BeanHookDispatcher(List<AutoAttachHook> hooks) {
    this.hooks = List.copyOf(hooks);
  }

  @Override
  public void run(HookPoint point, HookContext context) {
    logger.debug(
        "running hooks point={} consumerId={} hookCount={}",
        point.hookName(),
        context.consumerId(),
        hooks.size());
    for (AutoAttachHook hook : hooks) {
      try {
        switch (point) {
          case PRE_AUTO_ATTACH -> hook.preAutoAttach(context);
          case POST_AUTO_ATTACH -> hook.postAutoAttach(context);
        }
      } catch (RuntimeException ex) {
        // 後続 hook は実行せず、サイクル側で HOOK_ERROR として記録させる
        throw new HookExecutionException(point, hook.name(), ex);
      }
    }
  }
}
