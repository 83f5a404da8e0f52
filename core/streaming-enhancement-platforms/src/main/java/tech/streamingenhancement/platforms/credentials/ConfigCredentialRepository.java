package tech.streamingenhancement.platforms.credentials;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Credential repository backed by {@code streaming-enhancement.credentials.*} configuration.
 */
@ApplicationScoped
public class ConfigCredentialRepository implements CredentialRepository {

    private static final Logger LOG = Logger.getLogger(ConfigCredentialRepository.class);

    private final Map<Platform, OAuthCredential> credentials;

    @Inject
    public ConfigCredentialRepository(PlatformsConfig config) {
        this(config.credentials());
    }

    ConfigCredentialRepository(Map<String, PlatformsConfig.CredentialConfig> entries) {
        Map<Platform, OAuthCredential> loaded = new EnumMap<>(Platform.class);
        entries.forEach((id, entry) -> {
            Platform platform = Platform.fromId(id);
            if (isBlank(entry.clientId())) {
                throw new ConfigurationException("client-id is required for platform " + id);
            }
            if (isBlank(entry.clientSecret())) {
                throw new ConfigurationException("client-secret is required for platform " + id);
            }
            List<String> scopes = entry.scopes().orElse(List.of()).stream()
                .map(String::trim)
                .filter(scope -> !scope.isEmpty())
                .toList();
            loaded.put(platform, new OAuthCredential(platform, entry.clientId(), entry.clientSecret(), scopes));
        });
        this.credentials = Collections.unmodifiableMap(loaded);
        LOG.infof("Loaded OAuth client credentials for platforms: %s", loaded.keySet());
    }

    @Override
    public Optional<OAuthCredential> getCredential(Platform platform) {
        return Optional.ofNullable(credentials.get(platform));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
