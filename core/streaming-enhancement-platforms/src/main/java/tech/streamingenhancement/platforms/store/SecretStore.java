package tech.streamingenhancement.platforms.store;

import java.util.Optional;

/**
 * Key/value secret persistence keyed by (namespace, account).
 *
 * <p>Backed by the operating system keystore in production. Values are opaque strings.
 */
public interface SecretStore {

    /**
     * Namespace under which all daemon secrets are stored.
     */
    String NAMESPACE = "streaming-enhancement";

    /**
     * Read a secret.
     *
     * @param namespace The secret namespace
     * @param account The account key inside the namespace
     * @return The stored value, or empty if none is stored
     */
    Optional<String> get(String namespace, String account);

    /**
     * Store a secret, replacing any previous value.
     */
    void set(String namespace, String account, String value);

    /**
     * Check whether a secret is stored.
     */
    boolean has(String namespace, String account);

    /**
     * Delete a secret.
     *
     * @return true if a value was removed
     */
    boolean delete(String namespace, String account);
}
