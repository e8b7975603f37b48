package com.vaultconfig;

import com.azure.core.http.policy.ExponentialBackoffOptions;
import com.azure.core.http.policy.RetryOptions;
import com.azure.core.util.HttpClientOptions;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;

/**
 * Builds an Azure {@link SecretClient} for the vault and wraps it in a {@link SecretStore}.
 */
public final class AzureKeyVaultSecretStoreFactory implements SecretStoreFactory {

    @Override
    public SecretStore create(String vaultUrl, Credential credential, VaultClientOptions options) {
        SecretClient client = new SecretClientBuilder()
                .vaultUrl(vaultUrl)
                .credential(credential.toTokenCredential())
                .clientOptions(new HttpClientOptions().setResponseTimeout(options.getTimeout()))
                .retryOptions(new RetryOptions(new ExponentialBackoffOptions().setMaxRetries(options.getMaxRetries())))
                .buildClient();
        return new AzureKeyVaultSecretStore(client, vaultUrl);
    }
}
