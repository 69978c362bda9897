/*
 * どこで: 共通ユーティリティ
 * 何を: スケジュール実行単位の trace_id を採番し MDC キーを共有する
 * なぜ: HTTP リクエスト外で動くワーカーのログもトレース単位で追えるようにするため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
