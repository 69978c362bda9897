/*
 * どこで: AutoHeal Web 設定
 * 何を: RequestMdcInterceptor を autoheal API へ適用する
 * なぜ: actuator のスクレイプでログ用 MDC を汚さず、手動実行 API のみ追跡するため
 */
package com.example.autoheal.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String API_PATH_PATTERN = "/v1/autoheal/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATH_PATTERN);
  }
}
