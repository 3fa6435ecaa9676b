package com.creator.settlement.adapters;

import com.creator.settlement.core.SettlementGatewayException;
import com.creator.settlement.domain.PixKeyType;
import com.creator.settlement.domain.TransferRequest;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.domain.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AsaasSettlementGatewayTest {

    private static final String BASE_URL = "https://sandbox.asaas.test/api/v3";

    private MockRestServiceServer server;
    private AsaasSettlementGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new AsaasSettlementGateway(restTemplate, BASE_URL + "/", "test-key");
    }

    private static TransferRequest request() {
        return TransferRequest.builder()
                .amountDecimal(new BigDecimal("45.00"))
                .destinationKey("creator@example.com")
                .destinationKeyType(PixKeyType.EMAIL)
                .description("Creator payout")
                .externalReference("p-1")
                .build();
    }

    @Test
    void transferPostsPixInstruction() {
        server.expect(requestTo(BASE_URL + "/transfers"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("access_token", "test-key"))
                .andExpect(jsonPath("$.operationType").value("PIX"))
                .andExpect(jsonPath("$.pixAddressKey").value("creator@example.com"))
                .andExpect(jsonPath("$.pixAddressKeyType").value("EMAIL"))
                .andExpect(jsonPath("$.externalReference").value("p-1"))
                .andExpect(jsonPath("$.value").value(45.0))
                .andRespond(withSuccess("{\"id\":\"tr-1\",\"status\":\"PENDING\",\"value\":45.00,\"object\":\"transfer\"}",
                        MediaType.APPLICATION_JSON));

        TransferResult result = gateway.transfer(request());

        assertThat(result.getId()).isEqualTo("tr-1");
        assertThat(result.getStatus()).isEqualTo(TransferStatus.PENDING);
        assertThat(result.isRejected()).isFalse();
        server.verify();
    }

    @Test
    void getTransferCarriesFailReason() {
        server.expect(requestTo(BASE_URL + "/transfers/tr-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"id\":\"tr-1\",\"status\":\"FAILED\",\"failReason\":\"Invalid key\"}",
                        MediaType.APPLICATION_JSON));

        TransferResult result = gateway.getTransfer("tr-1");

        assertThat(result.isRejected()).isTrue();
        assertThat(result.getRawStatus()).isEqualTo("FAILED (Invalid key)");
    }

    @Test
    void unknownGatewayStatusIsTreatedAsInFlight() {
        server.expect(requestTo(BASE_URL + "/transfers/tr-1"))
                .andRespond(withSuccess("{\"id\":\"tr-1\",\"status\":\"AWAITING_CHECKOUT_RISK_ANALYSIS_REQUEST\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(gateway.getTransfer("tr-1").getStatus()).isEqualTo(TransferStatus.PENDING);
    }

    @Test
    void httpErrorBecomesGatewayException() {
        server.expect(requestTo(BASE_URL + "/transfers"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"errors\":[{\"code\":\"invalid_value\",\"description\":\"Saldo insuficiente\"}]}"));

        assertThatThrownBy(() -> gateway.transfer(request()))
                .isInstanceOf(SettlementGatewayException.class)
                .hasMessage("Asaas returned HTTP 400")
                .extracting(e -> ((SettlementGatewayException) e).getStatusCode())
                .isEqualTo(400);
    }

    @Test
    void ioFailureBecomesGatewayException() {
        server.expect(requestTo(BASE_URL + "/transfers"))
                .andRespond(withException(new IOException("Read timed out")));

        assertThatThrownBy(() -> gateway.transfer(request()))
                .isInstanceOf(SettlementGatewayException.class)
                .hasMessage("Asaas unreachable or timed out")
                .extracting(e -> ((SettlementGatewayException) e).getStatusCode())
                .isEqualTo(-1);
    }

    @Test
    void responseWithoutIdIsRejected() {
        server.expect(requestTo(BASE_URL + "/transfers"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.transfer(request()))
                .isInstanceOf(SettlementGatewayException.class)
                .extracting(e -> ((SettlementGatewayException) e).getStatusCode())
                .isEqualTo(502);
    }
}
