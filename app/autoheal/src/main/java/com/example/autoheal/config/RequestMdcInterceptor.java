/*
 * どこで: AutoHeal Web 設定
 * 何を: 手動実行 API のリクエスト単位で MDC キーを出し入れする
 * なぜ: スケジュール実行と手動実行のログを request_id で区別できるようにするため
 */
package com.example.autoheal.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, TraceIds.MDC_KEY, resolveTraceId());
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    return requestId == null || requestId.isBlank() ? TraceIds.newTraceId() : requestId;
  }

  // 既にトレース連携で trace_id が入っている場合は上書きしない
  private String resolveTraceId() {
    if (MDC.get(TraceIds.MDC_KEY) != null) {
      return null;
    }
    return TraceIds.newTraceId();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
