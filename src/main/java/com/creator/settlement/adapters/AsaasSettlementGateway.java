package com.creator.settlement.adapters;

import com.creator.settlement.core.SettlementGateway;
import com.creator.settlement.core.SettlementGatewayException;
import com.creator.settlement.domain.TransferRequest;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.domain.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PIX transfers through the Asaas API ({@code POST /transfers}, {@code GET /transfers/{id}}).
 * Blocking, bounded by the configured timeout, no retries.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "settlement.gateway.provider", havingValue = "asaas")
public class AsaasSettlementGateway implements SettlementGateway {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    @Autowired
    public AsaasSettlementGateway(@Value("${settlement.gateway.asaas.base-url}") String baseUrl,
                                  @Value("${settlement.gateway.asaas.api-key}") String apiKey,
                                  @Value("${settlement.gateway.asaas.timeout-ms:10000}") int timeoutMs) {
        this(createRestTemplate(timeoutMs), baseUrl, apiKey);
    }

    AsaasSettlementGateway(RestTemplate restTemplate, String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Asaas API key is not configured; transfers will be rejected by the gateway");
        }
    }

    private static RestTemplate createRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public String getName() {
        return "asaas";
    }

    @Override
    public TransferResult transfer(TransferRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("value", request.getAmountDecimal());
        body.put("operationType", "PIX");
        body.put("pixAddressKey", request.getDestinationKey());
        body.put("pixAddressKeyType", request.getDestinationKeyType().name());
        body.put("description", request.getDescription());
        body.put("externalReference", request.getExternalReference());

        AsaasTransferResponse response = call(HttpMethod.POST, "/transfers", body);
        log.info("Asaas transfer created: id={} status={} reference={}",
                response.getId(), response.getStatus(), request.getExternalReference());
        return toResult(response);
    }

    @Override
    public TransferResult getTransfer(String transferId) {
        return toResult(call(HttpMethod.GET, "/transfers/" + transferId, null));
    }

    private AsaasTransferResponse call(HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("access_token", apiKey);
        try {
            AsaasTransferResponse response = restTemplate.exchange(baseUrl + path, method,
                    new HttpEntity<>(body, headers), AsaasTransferResponse.class).getBody();
            if (response == null || response.getId() == null) {
                throw new SettlementGatewayException("Empty transfer response from Asaas", 502);
            }
            return response;
        } catch (RestClientResponseException e) {
            // Error body is {"errors":[{"code":...,"description":...}]}; kept for logs only
            log.warn("Asaas {} {} returned {}: {}", method, path, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new SettlementGatewayException("Asaas returned HTTP " + e.getStatusCode().value(), e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new SettlementGatewayException("Asaas unreachable or timed out", e);
        } catch (RestClientException e) {
            throw new SettlementGatewayException("Asaas call failed", e);
        }
    }

    private static TransferResult toResult(AsaasTransferResponse response) {
        return TransferResult.builder()
                .id(response.getId())
                .status(TransferStatus.fromGatewayValue(response.getStatus()))
                .rawStatus(response.getFailReason() != null
                        ? response.getStatus() + " (" + response.getFailReason() + ")"
                        : response.getStatus())
                .build();
    }
}
