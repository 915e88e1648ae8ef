package my.pietracker.app.broker;

import java.util.Optional;

/**
 * Per-user API key lookup. Implementations must never log the returned key.
 */
public interface CredentialStore {
	Optional<String> getUserApiKey(String userId, String serviceName);
}
