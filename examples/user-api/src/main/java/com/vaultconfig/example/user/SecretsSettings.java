package com.vaultconfig.example.user;

import org.springframework.core.env.Environment;

import java.util.Objects;

/**
 * Typed view of the {@code Secrets.*} keys, built once at startup.
 */
public final class SecretsSettings {

    public static final String CONNECTION_STRING_KEY = "secrets.connectionstring";

    private final String connectionString;

    public SecretsSettings(String connectionString) {
        this.connectionString = Objects.requireNonNull(connectionString, "connectionString");
    }

    /**
     * @throws IllegalStateException if the connection string is not configured
     */
    public static SecretsSettings from(Environment environment) {
        return new SecretsSettings(environment.getRequiredProperty(CONNECTION_STRING_KEY));
    }

    public String getConnectionString() {
        return connectionString;
    }
}
