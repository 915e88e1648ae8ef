package my.pietracker.app.broker;

import my.pietracker.app.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Component
public class ConfiguredCredentialStore implements CredentialStore {
	private final Map<String, Map<String, String>> apiKeys;

	public ConfiguredCredentialStore(AppProperties properties) {
		AppProperties.Credentials credentials = properties.credentials();
		this.apiKeys = credentials == null || credentials.apiKeys() == null ? Map.of() : credentials.apiKeys();
	}

	@Override
	public Optional<String> getUserApiKey(String userId, String serviceName) {
		if (userId == null || serviceName == null) {
			return Optional.empty();
		}
		Map<String, String> byService = apiKeys.get(userId);
		if (byService == null) {
			return Optional.empty();
		}
		String key = byService.get(serviceName);
		if (key == null || key.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(key.trim());
	}
}
