/*
 * どこで: AutoHeal API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: プロセス起動の動作確認を actuator なしでも行えるようにするため
 */
package com.example.autoheal.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "autoheal: ok";
  }
}
