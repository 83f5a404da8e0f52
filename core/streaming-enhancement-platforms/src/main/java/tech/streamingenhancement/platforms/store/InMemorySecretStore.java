package tech.streamingenhancement.platforms.store;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local secret store.
 *
 * <p>Secrets do not survive a restart. Used when no keystore-backed {@link SecretStore}
 * bean is provided, and in tests.
 */
@ApplicationScoped
@DefaultBean
public class InMemorySecretStore implements SecretStore {

    private final ConcurrentMap<String, String> secrets = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String namespace, String account) {
        return Optional.ofNullable(secrets.get(key(namespace, account)));
    }

    @Override
    public void set(String namespace, String account, String value) {
        secrets.put(key(namespace, account), value);
    }

    @Override
    public boolean has(String namespace, String account) {
        return secrets.containsKey(key(namespace, account));
    }

    @Override
    public boolean delete(String namespace, String account) {
        return secrets.remove(key(namespace, account)) != null;
    }

    private static String key(String namespace, String account) {
        return namespace + "\u0000" + account;
    }
}
