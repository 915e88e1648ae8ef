package my.pietracker.app.broker;

import com.fasterxml.jackson.databind.JsonNode;
import my.pietracker.app.client.ApiRequest;
import my.pietracker.app.client.ResilientApiClient;
import my.pietracker.app.config.ApiClientConfig;
import my.pietracker.app.config.AppProperties;
import my.pietracker.app.model.FailureReason;
import my.pietracker.app.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticated, cached access to the brokerage API. The cache scope is the user id so one user
 * never sees another user's responses.
 */
@Component
public class BrokerGateway {
	private static final Logger logger = LoggerFactory.getLogger(BrokerGateway.class);

	public static final String PIES = "/pies";
	public static final String INSTRUMENTS = "/metadata/instruments";
	public static final String CASH = "/account/cash";

	private final ResilientApiClient client;
	private final CredentialStore credentialStore;
	private final String baseUrl;
	private final String serviceName;
	private final Duration initialDelay;
	private final int maxRetries;

	public BrokerGateway(@Qualifier(ApiClientConfig.BROKER_CLIENT) ResilientApiClient client,
						 CredentialStore credentialStore,
						 AppProperties properties) {
		this.client = client;
		this.credentialStore = credentialStore;
		this.baseUrl = stripTrailingSlash(properties.broker().baseUrl());
		this.serviceName = properties.broker().serviceName();
		this.initialDelay = Duration.ofSeconds(properties.http().initialDelaySeconds());
		this.maxRetries = properties.http().maxRetries();
	}

	public static String pie(String pieId) {
		return PIES + "/" + pieId;
	}

	public FetchResult<JsonNode> get(String userId, String path) {
		Optional<String> apiKey = credentialStore.getUserApiKey(userId, serviceName);
		if (apiKey.isEmpty()) {
			logger.warn("No {} API key configured for user {}", serviceName, userId);
			return FetchResult.failure(FailureReason.MISSING_CREDENTIAL,
					"No API key configured for service " + serviceName);
		}
		Map<String, String> headers = Map.of(
				HttpHeaders.AUTHORIZATION, apiKey.get(),
				HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
		return client.request(ApiRequest.get(baseUrl + path, headers, userId, initialDelay, maxRetries));
	}

	private static String stripTrailingSlash(String url) {
		if (url != null && url.endsWith("/")) {
			return url.substring(0, url.length() - 1);
		}
		return url;
	}
}
