/*
 * どこで: AutoHeal サービス層
 * 何を: entitlement サービスを RestClient で呼び出すクライアント
 * なぜ: consumer 取得/compliance 評価/bind/権利一覧を HTTP 越しに行うため
 */
package com.example.autoheal.service;

import com.example.autoheal.config.EntitlementServiceProperties;
import com.example.autoheal.model.ConsumerAccount;
import com.example.autoheal.model.CoverageWindow;
import com.example.autoheal.model.EntitlementGrant;
import com.example.autoheal.service.dto.ComplianceResponse;
import com.example.autoheal.service.dto.ConsumerResponse;
import com.example.autoheal.service.dto.GrantResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RestEntitlementClient implements EntitlementClient {

  private static final Logger logger = LoggerFactory.getLogger(RestEntitlementClient.class);

  private final RestClient entitlementRestClient;
  private final EntitlementServiceProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public RestEntitlementClient(
      RestClient entitlementRestClient, EntitlementServiceProperties properties) {
    this.entitlementRestClient = entitlementRestClient;
    this.properties = properties;
  }

  @Override
  public ConsumerAccount getAccount(String consumerId) {
    validateConsumerId(consumerId);
    final ConsumerResponse response =
        execute(
            "getAccount",
            () ->
                entitlementRestClient
                    .get()
                    .uri(properties.consumerPath(), consumerId)
                    .retrieve()
                    .body(ConsumerResponse.class));
    if (response == null || isBlank(response.uuid())) {
      throw invalidResponse("consumer response is invalid");
    }
    return new ConsumerAccount(response.uuid(), response.name(), response.autoheal());
  }

  @Override
  public CoverageWindow getCompliance(String consumerId, Instant onDate) {
    validateConsumerId(consumerId);
    final ComplianceResponse response =
        execute(
            "getCompliance",
            () ->
                entitlementRestClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path(properties.compliancePath())
                                .queryParam("on_date", onDate.toString())
                                .build(consumerId))
                    .retrieve()
                    .body(ComplianceResponse.class));
    if (response == null || response.compliant() == null) {
      throw invalidResponse("compliance response is invalid");
    }
    if (!response.compliant()) {
      return CoverageWindow.invalid();
    }
    return CoverageWindow.validUntil(parseInstant(response.compliantUntil()));
  }

  @Override
  public List<EntitlementGrant> bind(String consumerId, Instant entitleDate) {
    validateConsumerId(consumerId);
    final GrantResponse[] response =
        execute(
            "bind",
            () ->
                entitlementRestClient
                    .post()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path(properties.entitlementsPath())
                                .queryParam("entitle_date", entitleDate.toString())
                                .build(consumerId))
                    .retrieve()
                    .body(GrantResponse[].class));
    return toGrants(response);
  }

  @Override
  public List<EntitlementGrant> listGrants(String consumerId) {
    validateConsumerId(consumerId);
    final GrantResponse[] response =
        execute(
            "listGrants",
            () ->
                entitlementRestClient
                    .get()
                    .uri(properties.entitlementsPath(), consumerId)
                    .retrieve()
                    .body(GrantResponse[].class));
    return toGrants(response);
  }

  private <T> T execute(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (RuntimeException ex) {
      logger.warn("entitlement {} response parse failed", operation, ex);
      throw new EntitlementServiceException(
          EntitlementServiceException.Reason.INVALID_RESPONSE,
          "entitlement response parse failed",
          ex);
    }
  }

  private List<EntitlementGrant> toGrants(GrantResponse[] response) {
    // bind で付与対象が無い場合、サーバは空配列または空ボディを返す
    if (response == null) {
      return List.of();
    }
    return Arrays.stream(response).map(this::toGrant).toList();
  }

  private EntitlementGrant toGrant(GrantResponse grant) {
    if (grant == null || isBlank(grant.id())) {
      throw invalidResponse("entitlement grant is invalid");
    }
    return new EntitlementGrant(
        grant.id(),
        grant.poolId(),
        grant.stockKeepingUnit(),
        grant.quantity() == null ? 1 : grant.quantity(),
        parseInstant(grant.startDate()),
        parseInstant(grant.endDate()));
  }

  private Instant parseInstant(String value) {
    if (isBlank(value)) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (RuntimeException ex) {
      throw new EntitlementServiceException(
          EntitlementServiceException.Reason.INVALID_RESPONSE,
          "entitlement response has invalid timestamp: " + value,
          ex);
    }
  }

  private EntitlementServiceException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "entitlement {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new EntitlementServiceException(
          EntitlementServiceException.Reason.NOT_FOUND, "entitlement consumer not found", ex);
    }
    if (status == 401 || status == 403) {
      return new EntitlementServiceException(
          EntitlementServiceException.Reason.UNAUTHORIZED, "entitlement rejected credentials", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new EntitlementServiceException(
          EntitlementServiceException.Reason.BAD_GATEWAY, "entitlement server error", ex);
    }
    return new EntitlementServiceException(
        EntitlementServiceException.Reason.BAD_GATEWAY, "entitlement request failed", ex);
  }

  private EntitlementServiceException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("entitlement {} timed out", operation);
      return new EntitlementServiceException(
          EntitlementServiceException.Reason.TIMEOUT, "entitlement request timeout", ex);
    }
    logger.warn("entitlement {} connection failed", operation, ex);
    return new EntitlementServiceException(
        EntitlementServiceException.Reason.BAD_GATEWAY, "entitlement connection failed", ex);
  }

  private EntitlementServiceException invalidResponse(String message) {
    return new EntitlementServiceException(
        EntitlementServiceException.Reason.INVALID_RESPONSE, message);
  }

  private void validateConsumerId(String consumerId) {
    if (isBlank(consumerId)) {
      throw new IllegalArgumentException("consumerId is required");
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
