package com.vaultconfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport settings handed to the vault client.
 */
public final class VaultClientOptions {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_MAX_RETRIES = 2;

    private final Duration timeout;
    private final int maxRetries;

    public VaultClientOptions(Duration timeout, int maxRetries) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
    }

    public static VaultClientOptions defaults() {
        return new VaultClientOptions(DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
