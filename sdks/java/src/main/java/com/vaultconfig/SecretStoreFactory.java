package com.vaultconfig;

/**
 * Creates the {@link SecretStore} for a vault address and credential.
 */
@FunctionalInterface
public interface SecretStoreFactory {

    SecretStore create(String vaultUrl, Credential credential, VaultClientOptions options);
}
