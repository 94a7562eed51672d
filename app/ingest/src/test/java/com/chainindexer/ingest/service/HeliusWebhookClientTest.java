package com.chainindexer.ingest.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.chainindexer.ingest.config.HeliusWebhookProperties;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class HeliusWebhookClientTest {

  private static final String EDIT_URL = "http://helius.test/v0/webhooks/wh-1?api-key=key-1";

  @Test
  void replaceAccountAddressesSendsFullDeduplicatedList() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture
        .server
        .expect(requestTo(EDIT_URL))
        .andExpect(method(PUT))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.webhookURL").value("https://indexer.test/v1/webhooks/helius"))
        .andExpect(jsonPath("$.transactionTypes[0]").value("ANY"))
        .andExpect(jsonPath("$.accountAddresses", Matchers.contains("M1", "M2")))
        .andExpect(jsonPath("$.webhookType").value("enhanced"))
        .andExpect(jsonPath("$.txnStatus").value("all"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    fixture.client.replaceAccountAddresses(List.of("M1", "M2", "M1"));

    fixture.server.verify();
  }

  @Test
  void replaceAccountAddressesAcceptsEmptyList() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture
        .server
        .expect(requestTo(EDIT_URL))
        .andExpect(jsonPath("$.accountAddresses", Matchers.empty()))
        .andRespond(withSuccess());

    fixture.client.replaceAccountAddresses(List.of());

    fixture.server.verify();
  }

  @Test
  void replaceAccountAddressesFailsFastWhenNotConfigured() {
    final ClientFixture fixture = newFixture(properties(null));

    assertReason(fixture, HeliusIntegrationException.Reason.NOT_CONFIGURED);
    fixture.server.verify();
  }

  @Test
  void replaceAccountAddressesMapsClientErrorToRejected() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture
        .server
        .expect(requestTo(EDIT_URL))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid api key\"}"));

    assertReason(fixture, HeliusIntegrationException.Reason.REJECTED);
  }

  @Test
  void replaceAccountAddressesMapsServerErrorToBadGateway() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture.server.expect(requestTo(EDIT_URL)).andRespond(withServerError());

    assertReason(fixture, HeliusIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void replaceAccountAddressesMapsReadTimeoutToTimeout() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture
        .server
        .expect(requestTo(EDIT_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, HeliusIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void replaceAccountAddressesMapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture(properties("key-1"));
    fixture
        .server
        .expect(requestTo(EDIT_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, HeliusIntegrationException.Reason.BAD_GATEWAY);
  }

  private static void assertReason(
      ClientFixture fixture, HeliusIntegrationException.Reason expected) {
    assertThatThrownBy(() -> fixture.client.replaceAccountAddresses(List.of("M1")))
        .isInstanceOf(HeliusIntegrationException.class)
        .extracting(ex -> ((HeliusIntegrationException) ex).reason())
        .isEqualTo(expected);
  }

  private static HeliusWebhookProperties properties(String apiKey) {
    return new HeliusWebhookProperties(
        "http://helius.test",
        apiKey,
        "wh-1",
        "https://indexer.test/v1/webhooks/helius",
        null,
        null);
  }

  private ClientFixture newFixture(HeliusWebhookProperties properties) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl(properties.baseUrl()).build();
    return new ClientFixture(new HeliusWebhookClient(restClient, properties), server);
  }

  private record ClientFixture(HeliusWebhookClient client, MockRestServiceServer server) {}
}
