/*
 * どこで: AutoHeal アプリのスモークテスト
 * 何を: Spring コンテキストの起動と主要 Bean の配線を確認する
 * なぜ: healing 判定/ロック/hook の構成が破壊されていないことを担保するため
 */
package com.example.autoheal;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.autoheal.service.BeanHookDispatcher;
import com.example.autoheal.service.CertificateRefresher;
import com.example.autoheal.service.HealingInvoker;
import com.example.autoheal.worker.AutoHealWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AutoHealApplicationTests {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(HealingInvoker.class)).isNotNull();
    assertThat(context.getBean(CertificateRefresher.class)).isNotNull();
    assertThat(context.getBean(BeanHookDispatcher.class)).isNotNull();
    // autoheal.enabled=false のテスト設定ではスケジュール実行しない
    assertThat(context.getBeansOfType(AutoHealWorker.class)).isEmpty();
  }
}
