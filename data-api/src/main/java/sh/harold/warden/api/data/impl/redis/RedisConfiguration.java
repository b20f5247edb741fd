package sh.harold.warden.api.data.impl.redis;

import java.util.Objects;

/**
 * Connection settings for the Redis-backed document store.
 */
public record RedisConfiguration(String host, int port, String password, int database, String keyPrefix) {

    public RedisConfiguration {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("Redis host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Redis port must be between 1 and 65535");
        }
        password = password == null ? "" : password;
        if (database < 0 || database > 15) {
            throw new IllegalArgumentException("Redis database must be between 0 and 15");
        }
        keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "warden:documents:" : keyPrefix;
    }

    public boolean hasPassword() {
        return password != null && !password.isBlank();
    }
}
