/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を Bean として公開する
 * なぜ: healing 判定の「今日/明日」を固定時刻のテストで再現できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
