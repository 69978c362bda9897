package com.example.autoheal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.autoheal.config.AutoHealProperties;
import org.junit.jupiter.api.Test;

class ConfiguredConsumerIdentityTest {

  @Test
  void returnsConfiguredConsumerId() {
    final ConfiguredConsumerIdentity identity =
        new ConfiguredConsumerIdentity(
            new AutoHealProperties(true, null, null, "consumer-1", null));

    assertThat(identity.consumerId()).isEqualTo("consumer-1");
  }

  @Test
  void failsWhenConsumerIdIsBlank() {
    final ConfiguredConsumerIdentity identity =
        new ConfiguredConsumerIdentity(new AutoHealProperties(true, null, null, " ", null));

    assertThatThrownBy(identity::consumerId)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("autoheal.consumer-id is not configured");
  }
}
