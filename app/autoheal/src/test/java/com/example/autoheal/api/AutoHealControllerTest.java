package com.example.autoheal.api;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.model.HealingError;
import com.example.autoheal.model.HealingErrorKind;
import com.example.autoheal.model.HealingReport;
import com.example.autoheal.service.CertificateRefresher;
import com.example.autoheal.service.HealingInvoker;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({AutoHealController.class, StatusController.class})
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AutoHealControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private HealingInvoker healingInvoker;

  @MockitoBean private CertificateRefresher certificateRefresher;

  @Test
  void runCycleReturnsReportAndRefreshesAfterwards() throws Exception {
    when(healingInvoker.invoke())
        .thenReturn(
            HealingReport.builder()
                .addGrants(
                    List.of(
                        new EntitlementGrant(
                            "grant-1",
                            "pool-1",
                            "sku-1",
                            1,
                            Instant.parse("2024-01-10T00:00:00Z"),
                            null)))
                .build());

    mockMvc
        .perform(post("/v1/autoheal/cycles"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.grants[0].grant_id").value("grant-1"))
        .andExpect(jsonPath("$.grants[0].stock_keeping_unit").value("sku-1"))
        .andExpect(jsonPath("$.grants[0].starts_at").value("2024-01-10T00:00:00Z"))
        .andExpect(jsonPath("$.errors").isEmpty());

    final InOrder order = inOrder(healingInvoker, certificateRefresher);
    order.verify(healingInvoker).invoke();
    order.verify(certificateRefresher).refresh();
  }

  @Test
  void lastCycleReturnsRecordedErrors() throws Exception {
    when(healingInvoker.lastReport())
        .thenReturn(
            Optional.of(
                HealingReport.builder()
                    .addError(
                        new HealingError(
                            HealingErrorKind.SERVICE_ERROR, "entitlement request timeout", null))
                    .addWarning("got valid status from server but no compliant-until date")
                    .build()));

    mockMvc
        .perform(get("/v1/autoheal/cycles/last"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.errors[0].kind").value("SERVICE_ERROR"))
        .andExpect(jsonPath("$.errors[0].message").value("entitlement request timeout"))
        .andExpect(jsonPath("$.warnings[0]").exists());
  }

  @Test
  void lastCycleReturns404BeforeFirstCycle() throws Exception {
    when(healingInvoker.lastReport()).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/autoheal/cycles/last"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("AUTOHEAL_NO_CYCLE"));
  }

  @Test
  void runCycleMapsUnexpectedFailureTo500() throws Exception {
    when(healingInvoker.invoke()).thenThrow(new IllegalStateException("lock interrupted"));

    mockMvc
        .perform(post("/v1/autoheal/cycles"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("AUTOHEAL_INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));

    verify(certificateRefresher, never()).refresh();
  }

  @Test
  void rootReturnsStatusText() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("autoheal: ok"));
  }
}
