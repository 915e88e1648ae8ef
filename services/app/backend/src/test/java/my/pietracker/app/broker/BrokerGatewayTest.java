package my.pietracker.app.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import my.pietracker.app.client.ApiRequest;
import my.pietracker.app.client.ResilientApiClient;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import my.pietracker.app.support.TestProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrokerGatewayTest {
	@Mock
	private ResilientApiClient client;

	@Mock
	private CredentialStore credentialStore;

	@Test
	void missingCredentialMakesNoCall() {
		when(credentialStore.getUserApiKey("alice", "trading212")).thenReturn(Optional.empty());
		BrokerGateway gateway = new BrokerGateway(client, credentialStore, TestProperties.defaults());

		FetchResult<JsonNode> result = gateway.get("alice", BrokerGateway.PIES);

		assertThat(result.failure()).isEqualTo(FailureReason.MISSING_CREDENTIAL);
		verifyNoInteractions(client);
	}

	@Test
	void sendsRawKeyAndScopesCacheByUser() {
		when(credentialStore.getUserApiKey("alice", "trading212")).thenReturn(Optional.of("alice-key"));
		when(client.request(any())).thenReturn(FetchResult.success(JsonNodeFactory.instance.arrayNode()));
		BrokerGateway gateway = new BrokerGateway(client, credentialStore, TestProperties.defaults());

		FetchResult<JsonNode> result = gateway.get("alice", BrokerGateway.pie("42"));

		ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
		verify(client).request(captor.capture());
		ApiRequest request = captor.getValue();
		assertThat(result.isSuccess()).isTrue();
		assertThat(request.url()).isEqualTo("http://localhost:1/equity/pies/42");
		assertThat(request.headers()).containsEntry("Authorization", "alice-key");
		assertThat(request.cacheScope()).isEqualTo("alice");
		assertThat(request.maxRetries()).isZero();
	}
}
