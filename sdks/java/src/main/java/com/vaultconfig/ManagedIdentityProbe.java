package com.vaultconfig;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.ManagedIdentityCredentialBuilder;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes the managed identity endpoint by requesting a token for the Key Vault scope.
 */
public final class ManagedIdentityProbe implements AmbientIdentityProbe {

    private static final Logger LOG = Logger.getLogger(ManagedIdentityProbe.class.getName());

    static final String VAULT_SCOPE = "https://vault.azure.net/.default";

    private final String clientId;

    public ManagedIdentityProbe() {
        this(null);
    }

    public ManagedIdentityProbe(String clientId) {
        this.clientId = clientId;
    }

    @Override
    public boolean isAvailable(Duration timeout) {
        ManagedIdentityCredentialBuilder builder = new ManagedIdentityCredentialBuilder();
        if (clientId != null) {
            builder.clientId(clientId);
        }
        TokenCredential credential = builder.build();
        try {
            AccessToken token = credential
                    .getToken(new TokenRequestContext().addScopes(VAULT_SCOPE))
                    .block(timeout);
            return token != null;
        } catch (RuntimeException e) {
            // Not running inside Azure, or the endpoint did not answer in time.
            LOG.log(Level.FINE, "[vaultconfig] Managed identity probe failed", e);
            return false;
        }
    }
}
