package com.vaultconfig;

import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import com.azure.security.keyvault.secrets.models.SecretProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link SecretStore} backed by an Azure Key Vault {@link SecretClient}.
 */
public final class AzureKeyVaultSecretStore implements SecretStore {

    private static final Logger LOG = Logger.getLogger(AzureKeyVaultSecretStore.class.getName());

    private final SecretClient client;
    private final String vaultUrl;

    public AzureKeyVaultSecretStore(SecretClient client, String vaultUrl) {
        this.client = Objects.requireNonNull(client, "client");
        this.vaultUrl = Objects.requireNonNull(vaultUrl, "vaultUrl");
    }

    @Override
    public Map<String, String> listSecrets() throws VaultConfigException {
        Map<String, String> secrets = new LinkedHashMap<>();
        try {
            for (SecretProperties properties : client.listPropertiesOfSecrets()) {
                if (Boolean.FALSE.equals(properties.isEnabled())) {
                    LOG.fine("[vaultconfig] Skipping disabled secret " + properties.getName());
                    continue;
                }
                KeyVaultSecret secret = client.getSecret(properties.getName());
                secrets.put(secret.getName(), secret.getValue());
            }
        } catch (RuntimeException e) {
            throw translate(e, null);
        }
        return Collections.unmodifiableMap(secrets);
    }

    @Override
    public String getSecret(String name) throws VaultConfigException {
        try {
            return client.getSecret(name).getValue();
        } catch (RuntimeException e) {
            throw translate(e, name);
        }
    }

    @Override
    public String location() {
        return vaultUrl;
    }

    /**
     * Map an Azure client failure onto the loader's exceptions. {@code secretName} is set for
     * single-secret lookups, where a 404 means the secret is missing rather than the vault.
     */
    VaultConfigException translate(RuntimeException e, String secretName) {
        if (e instanceof ClientAuthenticationException) {
            return new AuthenticationRejectedException("Authentication to " + vaultUrl + " was rejected", e);
        }
        if (e instanceof HttpResponseException) {
            int status = statusOf((HttpResponseException) e);
            if (status == 401 || status == 403) {
                return new AuthenticationRejectedException(
                        "Access to " + vaultUrl + " was denied (HTTP " + status + ")", e);
            }
            if (secretName != null && (e instanceof ResourceNotFoundException || status == 404)) {
                return new SecretNotFoundException(secretName, e);
            }
        }
        return new VaultUnreachableException("Failed to read secrets from " + vaultUrl + ": " + e.getMessage(), e);
    }

    private static int statusOf(HttpResponseException e) {
        return e.getResponse() != null ? e.getResponse().getStatusCode() : -1;
    }
}
